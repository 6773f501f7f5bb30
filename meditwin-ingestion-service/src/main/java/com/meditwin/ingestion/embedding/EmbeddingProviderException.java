package com.meditwin.ingestion.embedding;

/**
 * The embedding provider returned an error or an unusable response.
 */
public class EmbeddingProviderException extends RuntimeException {

    public EmbeddingProviderException(String message) {
        super(message);
    }

    public EmbeddingProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
