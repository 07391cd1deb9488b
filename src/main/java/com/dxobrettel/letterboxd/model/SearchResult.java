package com.dxobrettel.letterboxd.model;

public record SearchResult(
        String title,
        Integer year,
        String director,
        String link,
        String slug
) {
    /**
     * Label in the form {@code Seven Samurai (1954) - Akira Kurosawa}.
     */
    public String displayName() {
        StringBuilder sb = new StringBuilder(title);
        if (year != null) {
            sb.append(" (").append(year).append(")");
        }
        sb.append(" - ");
        if (director != null) {
            sb.append(director);
        }
        return sb.toString().trim();
    }
}
