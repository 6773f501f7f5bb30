package com.meditwin.common.identity;

/**
 * Raised when a patient identifier cannot be derived because the caller identifier is missing.
 */
public class InvalidCallerIdException extends IllegalArgumentException {

    public InvalidCallerIdException(String message) {
        super(message);
    }
}
