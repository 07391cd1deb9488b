package com.dxobrettel.letterboxd;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Builds the site's page and endpoint URLs and derives keys from them.
 *
 * <p>Title-keyed paths take the film slug ({@code seven-samurai}); id-keyed paths
 * take the numeric site-local id. The two families must not be mixed up.
 */
public final class LetterboxdUrls {

    public static final String DEFAULT_BASE_URL = "https://letterboxd.com";

    private final String baseUrl;

    public LetterboxdUrls(String baseUrl) {
        String trimmed = (baseUrl == null || baseUrl.isBlank()) ? DEFAULT_BASE_URL : baseUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        this.baseUrl = trimmed;
    }

    public String baseUrl() {
        return baseUrl;
    }

    public URI root() {
        return URI.create(baseUrl + "/");
    }

    public URI login() {
        return URI.create(baseUrl + "/user/login.do");
    }

    public URI dataExport() {
        return URI.create(baseUrl + "/data/export");
    }

    public URI metadata() {
        return URI.create(baseUrl + "/ajax/letterboxd-metadata/");
    }

    public URI saveDiaryEntry() {
        return URI.create(baseUrl + "/s/save-diary-entry");
    }

    public URI search(String query) {
        return URI.create(baseUrl + "/s/search/" + urlEncode(query.trim()) + "/");
    }

    // Slug-keyed

    public URI sidebarUserActions(String slug) {
        return URI.create(baseUrl + "/csi/film/" + slug + "/sidebar-user-actions/?esiAllowUser=true");
    }

    public URI filmPage(String slug) {
        return URI.create(baseUrl + "/film/" + slug + "/");
    }

    public URI addToWatchlist(String slug) {
        return URI.create(baseUrl + "/film/" + slug + "/add-to-watchlist/");
    }

    public URI removeFromWatchlist(String slug) {
        return URI.create(baseUrl + "/film/" + slug + "/remove-from-watchlist/");
    }

    // Id-keyed

    public URI like(long filmId) {
        return URI.create(baseUrl + "/s/film:" + filmId + "/like/");
    }

    public URI watch(long filmId) {
        return URI.create(baseUrl + "/s/film:" + filmId + "/watch/");
    }

    public URI rate(long filmId) {
        return URI.create(baseUrl + "/s/film:" + filmId + "/rate/");
    }

    /**
     * Makes a site-relative href absolute. Absolute hrefs are returned unchanged.
     */
    public String absolutize(String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        String h = href.trim();
        if (h.startsWith("http://") || h.startsWith("https://")) {
            return h;
        }
        return baseUrl + (h.startsWith("/") ? h : "/" + h);
    }

    public static String urlEncode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    /**
     * Last non-empty path segment of a URL: {@code https://letterboxd.com/film/seven-samurai/}
     * gives {@code seven-samurai}, {@code https://boxd.it/abc1} gives {@code abc1}.
     */
    public static Optional<String> trailingSegment(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        String path;
        try {
            URI uri = URI.create(url.trim());
            path = uri.getPath() != null ? uri.getPath() : url.trim();
        } catch (IllegalArgumentException e) {
            path = url.trim();
        }
        String[] parts = path.split("/");
        for (int i = parts.length - 1; i >= 0; i--) {
            if (!parts[i].isBlank()) {
                return Optional.of(parts[i]);
            }
        }
        return Optional.empty();
    }

    /**
     * Extracts the film slug from a {@code /film/<slug>/...} link.
     */
    public static Optional<String> slugFromFilmLink(String href) {
        if (href == null) {
            return Optional.empty();
        }
        int idx = href.indexOf("/film/");
        if (idx < 0) {
            return Optional.empty();
        }
        String rest = href.substring(idx + "/film/".length());
        int end = rest.indexOf('/');
        String slug = end >= 0 ? rest.substring(0, end) : rest;
        return slug.isBlank() ? Optional.empty() : Optional.of(slug);
    }

    /**
     * Encodes form fields as {@code application/x-www-form-urlencoded}. A list value
     * becomes one repeated field per element.
     */
    public static String formBody(Map<String, ?> fields) {
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, ?> entry : fields.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof List<?> list) {
                for (Object item : list) {
                    joiner.add(urlEncode(entry.getKey()) + "=" + urlEncode(String.valueOf(item)));
                }
            } else {
                joiner.add(urlEncode(entry.getKey()) + "=" + urlEncode(value == null ? "" : String.valueOf(value)));
            }
        }
        return joiner.toString();
    }
}
