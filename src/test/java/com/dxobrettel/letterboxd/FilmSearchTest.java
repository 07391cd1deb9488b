package com.dxobrettel.letterboxd;

import com.dxobrettel.letterboxd.error.ValidationException;
import com.dxobrettel.letterboxd.model.SearchResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FilmSearchTest {

    private FakeLetterboxd site;
    private FilmSearch search;

    @BeforeEach
    void setUp() throws Exception {
        site = new FakeLetterboxd();
        site.on("/s/search/", ex -> {
            if (ex.getRequestURI().getPath().contains("nothing")) {
                FakeLetterboxd.html(ex, 200, "<html><body><p>No results</p></body></html>");
                return;
            }
            FakeLetterboxd.html(ex, 200, """
                    <html><body><ul class="results">
                      <li><div class="film-detail-content">
                        <h2 class="headline-2"><span class="film-title-wrapper">
                          <a href="/film/seven-samurai/">Seven Samurai</a>
                          <small class="metadata"><a href="/films/year/1954/">1954</a></small>
                        </span></h2>
                        <p class="film-metadata">Directed by <a href="/director/akira-kurosawa/">Akira Kurosawa</a></p>
                      </div></li>
                      <li><div class="film-detail-content">
                        <h2 class="headline-2"><span class="film-title-wrapper">
                          <a href="/film/samurai-rebellion/">Samurai Rebellion</a>
                        </span></h2>
                      </div></li>
                    </ul></body></html>
                    """);
        });
        site.start();
        search = new FilmSearch(site.newSession());
    }

    @AfterEach
    void tearDown() {
        site.close();
    }

    @Test
    void parsesResultRows() throws Exception {
        List<SearchResult> results = search.search("seven samurai");

        assertEquals(2, results.size());
        SearchResult first = results.get(0);
        assertEquals("Seven Samurai", first.title());
        assertEquals(1954, first.year());
        assertEquals("Akira Kurosawa", first.director());
        assertEquals("seven-samurai", first.slug());
        assertEquals(site.baseUrl() + "/film/seven-samurai/", first.link());
        assertEquals("Seven Samurai (1954) - Akira Kurosawa", first.displayName());

        SearchResult second = results.get(1);
        assertNull(second.year());
        assertNull(second.director());
        assertEquals("samurai-rebellion", second.slug());
    }

    @Test
    void queryIsPathEncoded() throws Exception {
        search.search("seven samurai");
        assertEquals(1, site.requests().size());
        assertTrue(site.requests().get(0).path().startsWith("/s/search/seven"));
    }

    @Test
    void noMatchesGivesEmptyList() throws Exception {
        assertTrue(search.search("nothing here").isEmpty());
    }

    @Test
    void blankQueryIsRejected() {
        assertThrows(ValidationException.class, () -> search.search("  "));
        assertTrue(site.requests().isEmpty());
    }
}
