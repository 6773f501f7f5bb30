package com.meditwin.ingestion.extraction;

/**
 * The source document could not be opened or read.
 */
public class ExtractionException extends Exception {

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
