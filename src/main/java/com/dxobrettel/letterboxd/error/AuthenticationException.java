package com.dxobrettel.letterboxd.error;

/**
 * Login failed, or an operation that needs a logged-in session was attempted without one.
 */
public class AuthenticationException extends LetterboxdException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
