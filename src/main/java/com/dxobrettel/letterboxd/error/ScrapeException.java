package com.dxobrettel.letterboxd.error;

/**
 * An element or attribute the scraper relies on is missing from the page.
 */
public class ScrapeException extends LetterboxdException {

    public ScrapeException(String message) {
        super(message);
    }

    public ScrapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
