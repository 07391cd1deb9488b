package com.dxobrettel.letterboxd;

import com.dxobrettel.letterboxd.error.LetterboxdException;
import com.dxobrettel.letterboxd.model.FilmUserMetadata;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the logged-in user's watched, liked, watchlist and rating state for a film
 * from the metadata endpoint.
 */
public class FilmMetadataReader {

    private static final Logger log = LoggerFactory.getLogger(FilmMetadataReader.class);

    // request key is "ratables"; the reply lists them under "rateables"
    private static final String[] DETAIL_KINDS = {"posters", "likeables", "watchables", "ratables"};

    private final LetterboxdSession session;
    private final IdentifierResolver resolver;

    public FilmMetadataReader(LetterboxdSession session, IdentifierResolver resolver) {
        this.session = session;
        this.resolver = resolver;
    }

    public FilmUserMetadata fetchUserMetadata(String slug) throws LetterboxdException, InterruptedException {
        session.requireAuthenticated("fetch personalized metadata");
        long filmId = resolver.resolveSiteLocalId(slug);

        Map<String, Object> form = new LinkedHashMap<>();
        for (String kind : DETAIL_KINDS) {
            form.put(kind, "film:" + filmId);
        }
        JsonNode root = session.postExpectingResult(session.urls().metadata(), form, "Failed to fetch metadata for '" + slug + "'");

        FilmUserMetadata metadata = new FilmUserMetadata(
                anyFlag(root.get("watchables"), "watched"),
                anyFlag(root.get("likeables"), "liked"),
                LetterboxdSession.isTruthy(root.get("filmsInWatchlist")),
                firstRating(root.get("rateables"))
        );
        log.info("Fetched metadata for '{}': {}", slug, metadata);
        return metadata;
    }

    private static boolean anyFlag(JsonNode items, String field) {
        if (items == null || !items.isArray()) {
            return false;
        }
        for (JsonNode item : items) {
            if (item.path(field).asBoolean(false)) {
                return true;
            }
        }
        return false;
    }

    private static Integer firstRating(JsonNode items) {
        if (items == null || !items.isArray()) {
            return null;
        }
        for (JsonNode item : items) {
            if (item.hasNonNull("rating")) {
                return item.get("rating").asInt();
            }
        }
        return null;
    }
}
