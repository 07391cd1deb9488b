package com.dxobrettel.letterboxd;

import com.dxobrettel.cache.IdentifierCache;
import com.dxobrettel.letterboxd.error.AuthenticationException;
import com.dxobrettel.letterboxd.error.LetterboxdConnectionException;
import com.dxobrettel.letterboxd.model.FilmUserMetadata;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FilmMetadataReaderTest {

    @TempDir
    Path tempDir;

    private FakeLetterboxd site;
    private IdentifierCache cache;
    private volatile String metadataReply;

    @BeforeEach
    void setUp() throws Exception {
        metadataReply = """
                {
                  "result": true,
                  "watchables": [ { "uid": "film:51631", "watched": true } ],
                  "likeables": [ { "uid": "film:51631", "liked": false } ],
                  "rateables": [ { "uid": "film:51631", "rating": 8 } ],
                  "filmsInWatchlist": []
                }
                """;
        site = new FakeLetterboxd();
        site.on("/csi/film/", ex -> FakeLetterboxd.html(ex, 200, FakeLetterboxd.sidebar(51631)));
        site.on("/ajax/letterboxd-metadata/", ex -> FakeLetterboxd.json(ex, 200, metadataReply));
        site.start();
        cache = new IdentifierCache(tempDir.resolve("cache.db"));
    }

    @AfterEach
    void tearDown() {
        site.close();
    }

    private FilmMetadataReader reader(LetterboxdSession session) {
        return new FilmMetadataReader(session, new IdentifierResolver(session, cache));
    }

    @Test
    void readsUserState() throws Exception {
        FilmUserMetadata metadata = reader(site.loggedInSession()).fetchUserMetadata("seven-samurai");

        assertTrue(metadata.watched());
        assertFalse(metadata.liked());
        assertFalse(metadata.watchlisted());
        assertEquals(8, metadata.rating());
        assertTrue(metadata.isRated());

        FakeLetterboxd.Recorded post = site.requestsTo("/ajax/letterboxd-metadata/").get(0);
        assertEquals(List.of("posters", "likeables", "watchables", "ratables", LetterboxdSession.CSRF_FIELD),
                List.copyOf(post.form().keySet()));
        assertEquals("film:51631", post.field("ratables"));
        assertEquals("film:51631", post.field("watchables"));
        assertNull(post.field("rateables"));
    }

    @Test
    void unratedFilmHasNoRating() throws Exception {
        metadataReply = """
                {"result": true, "watchables": [], "likeables": [{"liked": true}], "rateables": [{"uid": "film:51631"}],
                 "filmsInWatchlist": [{"uid": "film:51631"}]}
                """;
        FilmUserMetadata metadata = reader(site.loggedInSession()).fetchUserMetadata("seven-samurai");

        assertFalse(metadata.watched());
        assertTrue(metadata.liked());
        assertTrue(metadata.watchlisted());
        assertNull(metadata.rating());
    }

    @Test
    void failedResultIsConnectionError() throws Exception {
        metadataReply = "{\"result\": false}";
        FilmMetadataReader reader = reader(site.loggedInSession());
        assertThrows(LetterboxdConnectionException.class, () -> reader.fetchUserMetadata("seven-samurai"));
    }

    @Test
    void requiresLogin() throws Exception {
        LetterboxdSession session = site.newSession();
        session.initialize();
        assertThrows(AuthenticationException.class, () -> reader(session).fetchUserMetadata("seven-samurai"));
    }
}
