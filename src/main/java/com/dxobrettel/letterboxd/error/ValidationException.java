package com.dxobrettel.letterboxd.error;

/**
 * A caller-supplied argument is outside its contract. Raised before any network call.
 */
public class ValidationException extends LetterboxdException {

    public ValidationException(String message) {
        super(message);
    }
}
