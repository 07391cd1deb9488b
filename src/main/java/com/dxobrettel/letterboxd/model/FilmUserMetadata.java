package com.dxobrettel.letterboxd.model;

/**
 * The logged-in user's state for one film.
 *
 * @param rating half-star rating on the 0..10 scale, or {@code null} when unrated
 */
public record FilmUserMetadata(
        boolean watched,
        boolean liked,
        boolean watchlisted,
        Integer rating
) {
    public boolean isRated() {
        return rating != null;
    }
}
