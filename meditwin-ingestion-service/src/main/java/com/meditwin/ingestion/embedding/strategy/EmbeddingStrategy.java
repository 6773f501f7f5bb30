package com.meditwin.ingestion.embedding.strategy;

import java.util.List;

/**
 * Strategy interface for embedding generation
 *
 * - Hides the embedding provider behind a batch call
 * - The active provider is picked by configuration (see EmbeddingProviderConfig)
 * - Switching providers changes vector dimensions, so the vector index must be rebuilt
 */
public interface EmbeddingStrategy {

    /**
     * Embed a batch of texts. Vectors come back in input order.
     */
    EmbeddingResult generateEmbeddings(List<String> texts);

    /**
     * Get the name of the active embedding provider
     */
    String getProviderName();

    /**
     * Get the number of dimensions this provider's embeddings produce
     */
    int getDimensions();

    /**
     * Result of a batch embedding call, encapsulates success/failure states
     */
    class EmbeddingResult {
        private final List<float[]> embeddings;
        private final String errorMessage;
        private final boolean successful;

        private EmbeddingResult(List<float[]> embeddings, String errorMessage, boolean successful) {
            this.embeddings = embeddings;
            this.errorMessage = errorMessage;
            this.successful = successful;
        }

        public static EmbeddingResult success(List<float[]> embeddings) {
            return new EmbeddingResult(List.copyOf(embeddings), null, true);
        }

        public static EmbeddingResult failed(String errorMessage) {
            return new EmbeddingResult(List.of(), errorMessage, false);
        }

        public List<float[]> getEmbeddings() {
            return embeddings;
        }

        public String getErrorMessage() {
            return errorMessage;
        }

        public boolean isSuccessful() {
            return successful;
        }

        public int getCount() {
            return embeddings.size();
        }
    }
}
