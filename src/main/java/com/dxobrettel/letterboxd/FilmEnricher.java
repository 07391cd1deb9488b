package com.dxobrettel.letterboxd;

import com.dxobrettel.letterboxd.error.LetterboxdException;
import com.dxobrettel.letterboxd.model.ResolvedLink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Resolves TMDb ids for many export rows at once on a fixed worker pool.
 *
 * <p>A row whose resolution fails comes back without an id; the rest of the batch
 * carries on. Only an interrupt aborts the whole call.
 */
public class FilmEnricher {

    private static final Logger log = LoggerFactory.getLogger(FilmEnricher.class);

    private final IdentifierResolver resolver;
    private final int workers;

    public FilmEnricher(IdentifierResolver resolver, int workers) {
        this.resolver = resolver;
        this.workers = Math.max(1, workers);
    }

    /**
     * @param pageUrls       film or diary-entry URLs, e.g. the "Letterboxd URI" column of an export
     * @param transientPages true when the URLs point at diary entries rather than film pages
     * @return one result per input URL, in input order
     */
    public List<ResolvedLink> resolveCrossReferenceIds(List<String> pageUrls, boolean transientPages) throws InterruptedException {
        if (pageUrls == null || pageUrls.isEmpty()) {
            return List.of();
        }
        Set<String> distinct = new LinkedHashSet<>(pageUrls);
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(workers, distinct.size()));
        try {
            Map<String, Future<Long>> pending = new LinkedHashMap<>();
            for (String url : distinct) {
                pending.put(url, pool.submit(() -> resolveOrNull(url, transientPages)));
            }

            Map<String, Long> resolved = new LinkedHashMap<>();
            for (Map.Entry<String, Future<Long>> entry : pending.entrySet()) {
                resolved.put(entry.getKey(), await(entry.getKey(), entry.getValue()));
            }

            List<ResolvedLink> results = new ArrayList<>(pageUrls.size());
            int misses = 0;
            for (String url : pageUrls) {
                Long id = resolved.get(url);
                if (id == null) {
                    misses++;
                }
                results.add(new ResolvedLink(url, id));
            }
            log.info("Resolved {} of {} TMDb ids", results.size() - misses, results.size());
            return results;
        } finally {
            pool.shutdownNow();
        }
    }

    private Long resolveOrNull(String url, boolean transientPage) throws InterruptedException {
        try {
            return resolver.resolveCrossReferenceId(url, transientPage);
        } catch (LetterboxdException e) {
            log.warn("No TMDb id for {}: {}", url, e.getMessage());
            return null;
        } catch (RuntimeException e) {
            log.warn("Resolution of {} failed: {}", url, e.toString());
            return null;
        }
    }

    private static Long await(String url, Future<Long> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InterruptedException ie) {
                throw ie;
            }
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Resolution of " + url + " failed", cause);
        }
    }
}
