package com.dxobrettel.letterboxd;

import com.dxobrettel.letterboxd.error.LetterboxdException;
import com.dxobrettel.letterboxd.error.ValidationException;
import com.dxobrettel.letterboxd.model.DiaryEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Authenticated mutations on a single film. Every call posts once with a freshly read
 * token and fails with a connection error on a non-200 reply or a falsy result flag.
 *
 * <p>Like, watch and rate are keyed by the site-local id, so they resolve it first.
 * Watchlist endpoints are keyed by the slug.
 */
public class FilmActions {

    private static final Logger log = LoggerFactory.getLogger(FilmActions.class);

    private final LetterboxdSession session;
    private final IdentifierResolver resolver;
    private final Clock clock;

    public FilmActions(LetterboxdSession session, IdentifierResolver resolver) {
        this(session, resolver, Clock.systemDefaultZone());
    }

    public FilmActions(LetterboxdSession session, IdentifierResolver resolver, Clock clock) {
        this.session = session;
        this.resolver = resolver;
        this.clock = clock;
    }

    public void setLikedStatus(String slug, boolean status) throws LetterboxdException, InterruptedException {
        session.requireAuthenticated("update liked status");
        long filmId = resolver.resolveSiteLocalId(slug);
        session.postExpectingResult(session.urls().like(filmId), Map.of("liked", status), "Failed to update like status");
        log.info("{} was successfully {}", slug, status ? "liked" : "unliked");
    }

    public void setWatchedStatus(String slug, boolean status) throws LetterboxdException, InterruptedException {
        session.requireAuthenticated("update watched status");
        long filmId = resolver.resolveSiteLocalId(slug);
        session.postExpectingResult(session.urls().watch(filmId), Map.of("watched", status), "Failed to update watched status");
        log.info("{} was successfully marked as {}", slug, status ? "watched" : "unwatched");
    }

    public void setWatchlistStatus(String slug, boolean status) throws LetterboxdException, InterruptedException {
        IdentifierResolver.requireSlug(slug);
        session.requireAuthenticated("update the watchlist");
        LetterboxdUrls urls = session.urls();
        String verb = status ? "add" : "remove";
        session.postExpectingResult(
                status ? urls.addToWatchlist(slug) : urls.removeFromWatchlist(slug),
                Map.of(),
                "Failed to " + verb + " watchlist entry"
        );
        log.info("{} was {} your watchlist", slug, status ? "added to" : "removed from");
    }

    /**
     * @param rating half stars, 0..10 inclusive
     */
    public void setRating(String slug, int rating) throws LetterboxdException, InterruptedException {
        if (rating < 0 || rating > 10) {
            throw new ValidationException("Invalid rating: " + rating + ". Rating must be between (inclusive) 0 and 10.");
        }
        session.requireAuthenticated("rate a film");
        long filmId = resolver.resolveSiteLocalId(slug);
        session.postExpectingResult(session.urls().rate(filmId), Map.of("rating", rating), "Failed to update rating");
        log.info("{} was successfully rated {}/10", slug, rating);
    }

    public void addDiaryEntry(String slug, DiaryEntry entry) throws LetterboxdException, InterruptedException {
        entry.validate();
        addDiaryEntry(slug, entry.toFormFields(clock));
    }

    /**
     * Posts a diary entry built by the caller. The film id and token are added here;
     * the caller's map is not modified.
     */
    public void addDiaryEntry(String slug, Map<String, ?> payload) throws LetterboxdException, InterruptedException {
        if (payload == null) {
            throw new ValidationException("Diary payload must not be null");
        }
        session.requireAuthenticated("add a diary entry");
        long filmId = resolver.resolveSiteLocalId(slug);

        Map<String, Object> form = new LinkedHashMap<>(payload);
        form.put("filmId", filmId);
        session.postExpectingResult(session.urls().saveDiaryEntry(), form, "Failed to add to diary");
        log.info("{} was added to your diary", slug);
    }
}
