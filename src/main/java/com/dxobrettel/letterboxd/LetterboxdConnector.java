package com.dxobrettel.letterboxd;

import com.dxobrettel.Config;
import com.dxobrettel.cache.IdentifierCache;
import com.dxobrettel.letterboxd.error.LetterboxdException;
import com.dxobrettel.letterboxd.model.FilmReference;
import com.dxobrettel.letterboxd.model.FilmUserMetadata;
import com.dxobrettel.letterboxd.model.ResolvedLink;
import com.dxobrettel.letterboxd.model.SearchResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Entry point for callers. Assembles the session, resolver and dispatcher around an
 * explicit cache handle and exposes the action-oriented operations.
 *
 * <p>Usage:
 * <pre>
 *   LetterboxdConnector lb = LetterboxdConnector.create(Config.load());
 *   lb.initialize();
 *   lb.login(config.getUsername(), config.getPassword());
 *   lb.perform("Add to watchlist", "seven-samurai");
 * </pre>
 */
public class LetterboxdConnector {

    private static final Logger log = LoggerFactory.getLogger(LetterboxdConnector.class);

    private final LetterboxdSession session;
    private final IdentifierCache cache;
    private final IdentifierResolver resolver;
    private final FilmActions actions;
    private final OperationDispatcher dispatcher;
    private final FilmMetadataReader metadataReader;
    private final FilmSearch search;
    private final FilmEnricher enricher;
    private final DataExportRetriever exporter;

    public LetterboxdConnector(LetterboxdSession session, IdentifierCache cache, int enrichWorkers) {
        this.session = session;
        this.cache = cache;
        this.resolver = new IdentifierResolver(session, cache);
        this.actions = new FilmActions(session, resolver);
        this.dispatcher = new OperationDispatcher(session, actions);
        this.metadataReader = new FilmMetadataReader(session, resolver);
        this.search = new FilmSearch(session);
        this.enricher = new FilmEnricher(resolver, enrichWorkers);
        this.exporter = new DataExportRetriever(session);
    }

    public static LetterboxdConnector create(Config config) {
        LetterboxdSession session = new LetterboxdSession(
                new LetterboxdUrls(config.getBaseUrl()),
                config.getUserAgent(),
                new ObjectMapper()
        );
        IdentifierCache cache = new IdentifierCache(config.getCachePath());
        log.info("Connector created for {} with cache {}", config.getBaseUrl(), config.getCachePath());
        return new LetterboxdConnector(session, cache, config.getEnrichWorkers());
    }

    // Session

    public void initialize() throws LetterboxdException, InterruptedException {
        session.initialize();
    }

    public void login(String username, String password) throws LetterboxdException, InterruptedException {
        session.login(username, password);
    }

    public boolean isAuthenticated() {
        return session.isAuthenticated();
    }

    // Public reads

    public List<SearchResult> search(String query) throws LetterboxdException, InterruptedException {
        return search.search(query);
    }

    public long resolveSiteLocalId(String slug) throws LetterboxdException, InterruptedException {
        return resolver.resolveSiteLocalId(slug);
    }

    public long resolveCrossReferenceId(String pageUrl, boolean transientPage) throws LetterboxdException, InterruptedException {
        return resolver.resolveCrossReferenceId(pageUrl, transientPage);
    }

    /**
     * Both ids for a slug. The TMDb half is left empty when it cannot be resolved; a
     * failure on the site-local half propagates.
     */
    public FilmReference resolveFilmReference(String slug) throws LetterboxdException, InterruptedException {
        long siteLocalId = resolver.resolveSiteLocalId(slug);
        Long crossReferenceId;
        try {
            crossReferenceId = resolver.resolveCrossReferenceIdForSlug(slug);
        } catch (LetterboxdException e) {
            log.warn("No TMDb id for '{}': {}", slug, e.getMessage());
            crossReferenceId = null;
        }
        return new FilmReference(slug, siteLocalId, crossReferenceId);
    }

    public List<ResolvedLink> enrich(List<String> pageUrls, boolean transientPages) throws InterruptedException {
        return enricher.resolveCrossReferenceIds(pageUrls, transientPages);
    }

    // Authenticated

    public FilmUserMetadata fetchUserMetadata(String slug) throws LetterboxdException, InterruptedException {
        return metadataReader.fetchUserMetadata(slug);
    }

    public void perform(String operationName, String slug, Object... extraArgs) throws LetterboxdException, InterruptedException {
        dispatcher.perform(operationName, slug, extraArgs);
    }

    public void perform(FilmOperation operation, String slug, Object... extraArgs) throws LetterboxdException, InterruptedException {
        dispatcher.perform(operation, slug, extraArgs);
    }

    public Path downloadExport(Path destinationDir) throws LetterboxdException, InterruptedException {
        return exporter.downloadAndExtract(destinationDir);
    }

    public FilmActions actions() {
        return actions;
    }

    public IdentifierCache cache() {
        return cache;
    }
}
