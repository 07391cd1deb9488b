package com.dxobrettel.letterboxd.model;

import com.dxobrettel.letterboxd.error.ValidationException;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fields of a diary entry as the save-diary-entry form expects them.
 *
 * @param viewingDate date watched; {@code null} posts today's date with {@code specifiedDate=false}
 * @param rating      0..10 (half stars), 0 meaning no rating
 */
public record DiaryEntry(
        LocalDate viewingDate,
        int rating,
        boolean liked,
        String review,
        boolean containsSpoilers,
        boolean rewatch,
        List<String> tags
) {
    public DiaryEntry {
        review = review == null ? "" : review;
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static DiaryEntry watchedToday(int rating, boolean liked) {
        return new DiaryEntry(null, rating, liked, "", false, false, List.of());
    }

    public void validate() throws ValidationException {
        if (rating < 0 || rating > 10) {
            throw new ValidationException("Invalid rating: " + rating + ". Rating must be between (inclusive) 0 and 10.");
        }
        if (containsSpoilers && review.isBlank()) {
            throw new ValidationException("A spoiler flag needs a review");
        }
    }

    public Map<String, Object> toFormFields(Clock clock) {
        Map<String, Object> form = new LinkedHashMap<>();
        boolean specified = viewingDate != null;
        LocalDate date = specified ? viewingDate : LocalDate.now(clock);
        form.put("specifiedDate", specified);
        form.put("viewingDateStr", date.toString());
        form.put("rating", rating);
        form.put("liked", liked);
        form.put("review", review);
        form.put("containsSpoilers", containsSpoilers);
        form.put("rewatch", rewatch);
        if (!tags.isEmpty()) {
            form.put("tag", tags);
        }
        return form;
    }
}
