package com.dxobrettel.letterboxd;

import com.dxobrettel.cache.IdentifierCache;
import com.dxobrettel.letterboxd.error.LetterboxdConnectionException;
import com.dxobrettel.letterboxd.error.LetterboxdException;
import com.dxobrettel.letterboxd.error.ScrapeException;
import com.dxobrettel.letterboxd.error.UnsupportedCategoryException;
import com.dxobrettel.letterboxd.error.ValidationException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Scrapes film pages for the two identifiers the rest of the connector needs: the
 * site-local film id and the TMDb cross-reference id. Both are cached permanently;
 * {@link IdentifierCache#clear} is the only way to invalidate them.
 *
 * <p>Concurrent calls for the same key may both miss and both fetch. They write the
 * same value, so the duplicate costs a request and nothing else.
 */
public class IdentifierResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentifierResolver.class);

    public static final String SITE_LOCAL_NAMESPACE = "slug_to_local_id";
    public static final String CROSS_REFERENCE_NAMESPACE = "url_to_xref_id";
    public static final String SUPPORTED_CATEGORY = "movie";

    static final String RATING_FORM_ID = "frm-sidebar-rating";
    static final String RATEABLE_ATTR = "data-rateable-uid";
    static final String XREF_LINK_SELECTOR = "a[data-track-action=TMDb]";
    static final String TITLE_LINK_SELECTOR = "span.film-title-wrapper > a";

    private final LetterboxdSession session;
    private final IdentifierCache cache;

    public IdentifierResolver(LetterboxdSession session, IdentifierCache cache) {
        this.session = session;
        this.cache = cache;
    }

    /**
     * Site-local id for a film slug, read from the {@code film:<id>} uid on the
     * sidebar rating form.
     */
    public long resolveSiteLocalId(String slug) throws LetterboxdException, InterruptedException {
        requireSlug(slug);
        Optional<Long> cached = cache.get(SITE_LOCAL_NAMESPACE, slug);
        if (cached.isPresent()) {
            log.debug("Cache hit for slug {}: {}", slug, cached.get());
            return cached.get();
        }

        log.debug("Cache miss for slug {}, scraping", slug);
        URI url = session.urls().sidebarUserActions(slug);
        Document page = Jsoup.parse(session.getPage(url), url.toString());
        long id = extractSiteLocalId(page, slug);

        cache.save(SITE_LOCAL_NAMESPACE, slug, id);
        log.info("Resolved Letterboxd id {} for '{}'", id, slug);
        return id;
    }

    /**
     * TMDb id for the film at {@code pageUrl}.
     *
     * @param transientPage true for contextual views (diary entries) that carry no TMDb
     *                      link; the title anchor is followed to the film page first
     * @throws UnsupportedCategoryException if the link points at anything but a movie
     * @throws ScrapeException              if the expected link or anchor is missing
     */
    public long resolveCrossReferenceId(String pageUrl, boolean transientPage) throws LetterboxdException, InterruptedException {
        String key = crossReferenceKey(pageUrl);
        Optional<Long> cached = cache.get(CROSS_REFERENCE_NAMESPACE, key);
        if (cached.isPresent()) {
            log.debug("Cache hit for {}: TMDb {}", key, cached.get());
            return cached.get();
        }

        log.debug("Cache miss for {} (transient={}), scraping", pageUrl, transientPage);
        long id = scrapeCrossReferenceId(pageUrl, transientPage);

        cache.save(CROSS_REFERENCE_NAMESPACE, key, id);
        log.info("Resolved TMDb id {} for {}", id, pageUrl);
        return id;
    }

    /**
     * TMDb id for a film slug, looked up on its canonical film page.
     */
    public long resolveCrossReferenceIdForSlug(String slug) throws LetterboxdException, InterruptedException {
        requireSlug(slug);
        return resolveCrossReferenceId(session.urls().filmPage(slug).toString(), false);
    }

    /**
     * Cache key for a page URL. Film pages and diary entries ({@code /<user>/film/<slug>/2/})
     * key on the film slug; URLs without a {@code /film/} part, such as short links, key on
     * their last path segment.
     */
    public static String crossReferenceKey(String pageUrl) throws ScrapeException {
        return LetterboxdUrls.slugFromFilmLink(pageUrl)
                .or(() -> LetterboxdUrls.trailingSegment(pageUrl))
                .orElseThrow(() -> new ScrapeException("Cannot derive a cache key from URL '" + pageUrl + "'"));
    }

    // =========================================================================
    // Scraping
    // =========================================================================

    private long scrapeCrossReferenceId(String pageUrl, boolean transientPage) throws LetterboxdException, InterruptedException {
        URI uri = toUri(pageUrl);
        Document page = Jsoup.parse(session.getPage(uri), uri.toString());

        if (transientPage) {
            Element titleLink = page.selectFirst(TITLE_LINK_SELECTOR);
            String target = titleLink == null ? null : session.urls().absolutize(titleLink.attr("href"));
            if (target == null) {
                throw new ScrapeException("No film link found on transient page " + pageUrl);
            }
            log.debug("Following transient page {} to {}", pageUrl, target);
            URI filmUri = toUri(target);
            page = Jsoup.parse(session.getPage(filmUri), filmUri.toString());
        }

        return extractCrossReferenceId(page, pageUrl);
    }

    static long extractSiteLocalId(Document page, String slug) throws ScrapeException {
        Element form = page.getElementById(RATING_FORM_ID);
        if (form == null || !form.hasAttr(RATEABLE_ATTR)) {
            throw new ScrapeException("No rateable uid found for '" + slug + "'. Page layout changed or slug invalid.");
        }
        String uid = form.attr(RATEABLE_ATTR);
        int colon = uid.indexOf(':');
        if (colon < 0 || colon == uid.length() - 1) {
            throw new ScrapeException("Malformed rateable uid '" + uid + "' for '" + slug + "'");
        }
        return parseId(uid.substring(colon + 1), "rateable uid for '" + slug + "'");
    }

    static long extractCrossReferenceId(Document page, String pageUrl) throws LetterboxdException {
        Element link = page.selectFirst(XREF_LINK_SELECTOR);
        if (link == null || link.attr("href").isBlank()) {
            throw new ScrapeException("No TMDb link found on " + pageUrl);
        }
        String href = link.attr("href");
        List<String> segments = pathSegments(href);
        if (segments.size() < 2) {
            throw new ScrapeException("Unexpected TMDb link '" + href + "' on " + pageUrl);
        }
        String category = segments.get(segments.size() - 2);
        if (!SUPPORTED_CATEGORY.equals(category)) {
            throw new UnsupportedCategoryException(category, SUPPORTED_CATEGORY);
        }
        return parseId(segments.get(segments.size() - 1), "TMDb link '" + href + "'");
    }

    private static List<String> pathSegments(String href) {
        String path;
        try {
            URI uri = URI.create(href.trim());
            path = uri.getPath() == null ? href : uri.getPath();
        } catch (IllegalArgumentException e) {
            path = href;
        }
        List<String> segments = new ArrayList<>();
        for (String part : path.split("/")) {
            if (!part.isBlank()) {
                segments.add(part);
            }
        }
        return segments;
    }

    private static long parseId(String raw, String what) throws ScrapeException {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new ScrapeException("Non-numeric id in " + what, e);
        }
    }

    private static URI toUri(String url) throws LetterboxdConnectionException {
        try {
            return URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new LetterboxdConnectionException("Invalid URL '" + url + "'", e);
        }
    }

    static void requireSlug(String slug) throws ValidationException {
        if (slug == null || slug.isBlank() || slug.contains("/")) {
            throw new ValidationException("Invalid film slug '" + slug + "'");
        }
    }
}
