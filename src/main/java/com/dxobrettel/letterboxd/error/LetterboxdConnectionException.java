package com.dxobrettel.letterboxd.error;

/**
 * A request that was expected to succeed returned a non-200 status, a falsy
 * {@code result} flag, an unreadable body, or failed in transport.
 */
public class LetterboxdConnectionException extends LetterboxdException {

    private final int statusCode;

    public LetterboxdConnectionException(String message) {
        this(message, -1);
    }

    public LetterboxdConnectionException(String message, int statusCode) {
        super(statusCode > 0 ? message + " (HTTP " + statusCode + ")" : message);
        this.statusCode = statusCode;
    }

    public LetterboxdConnectionException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * @return the HTTP status that caused the failure, or -1 when there was no response
     */
    public int getStatusCode() {
        return statusCode;
    }
}
