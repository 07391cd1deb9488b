package com.dxobrettel.letterboxd;

import com.dxobrettel.cache.IdentifierCache;
import com.dxobrettel.letterboxd.error.AuthenticationException;
import com.dxobrettel.letterboxd.error.UnknownOperationException;
import com.dxobrettel.letterboxd.error.ValidationException;
import com.dxobrettel.letterboxd.model.DiaryEntry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OperationDispatcherTest {

    @TempDir
    Path tempDir;

    private FakeLetterboxd site;
    private IdentifierCache cache;

    @BeforeEach
    void setUp() throws Exception {
        site = new FakeLetterboxd();
        site.on("/csi/film/", ex -> FakeLetterboxd.html(ex, 200, FakeLetterboxd.sidebar(7)));
        site.on("/s/", ex -> FakeLetterboxd.json(ex, 200, "{\"result\":true}"));
        site.on("/film/", ex -> FakeLetterboxd.json(ex, 200, "{\"result\":true}"));
        site.start();
        cache = new IdentifierCache(tempDir.resolve("cache.db"));
    }

    @AfterEach
    void tearDown() {
        site.close();
    }

    private OperationDispatcher dispatcher(LetterboxdSession session) {
        return new OperationDispatcher(session, new FilmActions(session, new IdentifierResolver(session, cache)));
    }

    @Test
    void unauthenticatedSessionMakesNoRequests() throws Exception {
        LetterboxdSession session = site.newSession();
        session.initialize();
        site.clearRequests();
        OperationDispatcher dispatcher = dispatcher(session);

        assertThrows(AuthenticationException.class, () -> dispatcher.perform("Add to watchlist", "seven-samurai"));
        assertThrows(AuthenticationException.class, () -> dispatcher.perform("No such thing", "seven-samurai"));
        assertThrows(AuthenticationException.class, () -> dispatcher.perform(FilmOperation.UPDATE_RATING, "seven-samurai", 5));
        assertTrue(site.requests().isEmpty());
    }

    @Test
    void unknownOperationIsRejected() throws Exception {
        OperationDispatcher dispatcher = dispatcher(site.loggedInSession());

        UnknownOperationException e = assertThrows(UnknownOperationException.class,
                () -> dispatcher.perform("Delete account", "seven-samurai"));
        assertTrue(e.getMessage().contains("Delete account"));
        assertTrue(site.requests().isEmpty());
    }

    @Test
    void toggleOperationsInjectTheirStatus() throws Exception {
        OperationDispatcher dispatcher = dispatcher(site.loggedInSession());

        dispatcher.perform("Remove from liked films", "seven-samurai");
        dispatcher.perform("mark film as watched", "seven-samurai");

        assertEquals("false", site.requestsTo("/s/film:7/like/").get(0).field("liked"));
        assertEquals("true", site.requestsTo("/s/film:7/watch/").get(0).field("watched"));
    }

    @Test
    void watchlistRemovalHitsRemoveEndpoint() throws Exception {
        OperationDispatcher dispatcher = dispatcher(site.loggedInSession());

        dispatcher.perform(FilmOperation.REMOVE_FROM_WATCHLIST, "seven-samurai");

        assertEquals(1, site.requestsTo("/film/seven-samurai/remove-from-watchlist/").size());
    }

    @Test
    void ratingTakesSingleIntegerArgument() throws Exception {
        OperationDispatcher dispatcher = dispatcher(site.loggedInSession());

        dispatcher.perform("Update film rating", "seven-samurai", 9);
        assertEquals("9", site.requestsTo("/s/film:7/rate/").get(0).field("rating"));

        assertThrows(ValidationException.class, () -> dispatcher.perform("Update film rating", "seven-samurai"));
        assertThrows(ValidationException.class, () -> dispatcher.perform("Update film rating", "seven-samurai", "nine"));
    }

    @Test
    void diaryAcceptsEntryOrMap() throws Exception {
        OperationDispatcher dispatcher = dispatcher(site.loggedInSession());

        dispatcher.perform(FilmOperation.ADD_TO_DIARY, "seven-samurai", DiaryEntry.watchedToday(7, false));
        dispatcher.perform(FilmOperation.ADD_TO_DIARY, "seven-samurai", Map.of("rating", 4));

        assertEquals(2, site.requestsTo("/s/save-diary-entry").size());
        assertThrows(ValidationException.class, () -> dispatcher.perform(FilmOperation.ADD_TO_DIARY, "seven-samurai", 4));
    }
}
