package com.dxobrettel.letterboxd;

import com.dxobrettel.letterboxd.error.UnknownOperationException;
import com.dxobrettel.letterboxd.model.FilmUserMetadata;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FilmOperationTest {

    @Test
    void looksUpByLabelIgnoringCase() throws Exception {
        assertEquals(FilmOperation.ADD_TO_WATCHLIST, FilmOperation.fromLabel("Add to watchlist"));
        assertEquals(FilmOperation.UNMARK_WATCHED, FilmOperation.fromLabel("  un-mark film as watched "));
        assertThrows(UnknownOperationException.class, () -> FilmOperation.fromLabel("Add to list"));
        assertThrows(UnknownOperationException.class, () -> FilmOperation.fromLabel(null));
    }

    @Test
    void togglesCarryFixedStatus() {
        assertEquals(Boolean.TRUE, FilmOperation.ADD_TO_LIKED.status());
        assertEquals(Boolean.FALSE, FilmOperation.REMOVE_FROM_WATCHLIST.status());
        assertNull(FilmOperation.UPDATE_RATING.status());
        assertEquals(FilmOperation.Handler.DIARY, FilmOperation.ADD_TO_DIARY.handler());
    }

    @Test
    void offersOppositeOfCurrentState() {
        List<FilmOperation> fresh = FilmOperation.availableFor(new FilmUserMetadata(false, false, false, null));
        assertEquals(List.of(
                FilmOperation.MARK_WATCHED,
                FilmOperation.ADD_TO_LIKED,
                FilmOperation.ADD_TO_WATCHLIST,
                FilmOperation.UPDATE_RATING,
                FilmOperation.ADD_TO_DIARY
        ), fresh);

        List<FilmOperation> seen = FilmOperation.availableFor(new FilmUserMetadata(true, true, true, 9));
        assertTrue(seen.contains(FilmOperation.UNMARK_WATCHED));
        assertTrue(seen.contains(FilmOperation.REMOVE_FROM_LIKED));
        assertTrue(seen.contains(FilmOperation.REMOVE_FROM_WATCHLIST));
        assertFalse(seen.contains(FilmOperation.MARK_WATCHED));
    }

    @Test
    void printsLabel() {
        assertEquals("Update film rating", FilmOperation.UPDATE_RATING.toString());
    }
}
