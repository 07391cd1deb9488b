package com.dxobrettel.letterboxd.model;

/**
 * Outcome of resolving one page URL during bulk enrichment.
 *
 * @param crossReferenceId resolved id, or {@code null} if resolution failed for this row
 */
public record ResolvedLink(
        String url,
        Long crossReferenceId
) {
    public boolean isResolved() {
        return crossReferenceId != null;
    }
}
