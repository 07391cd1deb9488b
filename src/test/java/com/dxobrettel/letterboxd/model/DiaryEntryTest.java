package com.dxobrettel.letterboxd.model;

import com.dxobrettel.letterboxd.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DiaryEntryTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-09T12:00:00Z"), ZoneOffset.UTC);

    @Test
    void unspecifiedDateUsesToday() {
        Map<String, Object> form = DiaryEntry.watchedToday(6, true).toFormFields(clock);

        assertEquals(false, form.get("specifiedDate"));
        assertEquals("2024-03-09", form.get("viewingDateStr"));
        assertEquals(6, form.get("rating"));
        assertEquals(true, form.get("liked"));
        assertFalse(form.containsKey("tag"));
    }

    @Test
    void tagsBecomeRepeatedField() {
        DiaryEntry entry = new DiaryEntry(LocalDate.of(2023, 12, 31), 0, false, null, false, true, List.of("nye"));
        Map<String, Object> form = entry.toFormFields(clock);

        assertEquals(true, form.get("specifiedDate"));
        assertEquals("2023-12-31", form.get("viewingDateStr"));
        assertEquals("", form.get("review"));
        assertEquals(List.of("nye"), form.get("tag"));
    }

    @Test
    void validatesRatingAndSpoilers() {
        assertThrows(ValidationException.class, () -> DiaryEntry.watchedToday(11, false).validate());
        assertThrows(ValidationException.class,
                () -> new DiaryEntry(null, 5, false, "", true, false, null).validate());
        assertDoesNotThrow(() -> new DiaryEntry(null, 10, false, "Ending!", true, false, null).validate());
    }
}
