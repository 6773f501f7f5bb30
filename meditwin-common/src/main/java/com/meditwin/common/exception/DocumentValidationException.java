package com.meditwin.common.exception;

/**
 * Raised when an uploaded document is rejected before processing (size or type).
 */
public class DocumentValidationException extends IllegalArgumentException {

    public DocumentValidationException(String message) {
        super(message);
    }
}
