package com.dxobrettel.letterboxd;

import com.dxobrettel.letterboxd.error.LetterboxdException;
import com.dxobrettel.letterboxd.error.ValidationException;
import com.dxobrettel.letterboxd.model.SearchResult;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Film search over the public search page. Needs no login.
 */
public class FilmSearch {

    private static final Logger log = LoggerFactory.getLogger(FilmSearch.class);

    private final LetterboxdSession session;

    public FilmSearch(LetterboxdSession session) {
        this.session = session;
    }

    public List<SearchResult> search(String query) throws LetterboxdException, InterruptedException {
        if (query == null || query.isBlank()) {
            throw new ValidationException("Search query must not be blank");
        }
        URI url = session.urls().search(query);
        Document page = Jsoup.parse(session.getPage(url), url.toString());

        List<SearchResult> results = new ArrayList<>();
        for (Element film : page.select("div.film-detail-content")) {
            Element titleLink = film.selectFirst("h2 span a");
            if (titleLink == null) {
                continue;
            }
            String href = titleLink.attr("href");
            Element yearLink = film.selectFirst("h2 span small a");
            Element directorLink = film.selectFirst("p a");
            results.add(new SearchResult(
                    titleLink.ownText().strip(),
                    parseYear(yearLink),
                    directorLink == null ? null : directorLink.text().strip(),
                    session.urls().absolutize(href),
                    LetterboxdUrls.slugFromFilmLink(href).orElse(null)
            ));
        }

        if (results.isEmpty()) {
            log.warn("No results found for query: {}", query);
        } else {
            log.info("Found {} results for query: {}", results.size(), query);
        }
        return results;
    }

    private static Integer parseYear(Element yearLink) {
        if (yearLink == null) {
            return null;
        }
        try {
            return Integer.parseInt(yearLink.text().strip());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
