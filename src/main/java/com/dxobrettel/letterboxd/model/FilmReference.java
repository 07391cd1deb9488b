package com.dxobrettel.letterboxd.model;

/**
 * Both identifiers known for one film. Never persisted as a unit; each half is cached
 * on its own.
 *
 * @param crossReferenceId TMDb id, or {@code null} when the film page links none
 */
public record FilmReference(
        String slug,
        long siteLocalId,
        Long crossReferenceId
) {
    public boolean hasCrossReferenceId() {
        return crossReferenceId != null;
    }
}
