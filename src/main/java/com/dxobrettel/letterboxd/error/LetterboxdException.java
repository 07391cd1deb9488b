package com.dxobrettel.letterboxd.error;

/**
 * Base type for every failure raised while talking to Letterboxd.
 */
public class LetterboxdException extends Exception {

    public LetterboxdException(String message) {
        super(message);
    }

    public LetterboxdException(String message, Throwable cause) {
        super(message, cause);
    }
}
