package com.meditwin.ingestion.config;

import com.meditwin.ingestion.embedding.GoogleEmbeddingsService;
import com.meditwin.ingestion.embedding.strategy.EmbeddingStrategy;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Factory for embedding provider instances
 *
 * Static factory: the provider set is fixed and creation is a constructor call.
 */
@Slf4j
public class EmbeddingProviderFactory {

    private EmbeddingProviderFactory() {
    }

    /**
     * Create an EmbeddingStrategy based on provider name
     *
     * NOTE: Switching embedding providers requires re-indexing every patient namespace in Pinecone
     * because different providers produce different vector dimensions.
     *
     * @param provider Provider name: "google"
     * @param apiKey   API key for the provider
     * @param baseUrl  Base URL for the provider's API
     * @param model    Model name to use
     * @param timeout  Per-request timeout
     * @return Configured EmbeddingStrategy implementation
     * @throws IllegalArgumentException if provider is not supported
     */
    public static EmbeddingStrategy createEmbeddingGenerator(
            String provider, String apiKey, String baseUrl, String model, Duration timeout) {

        return switch (provider.toLowerCase()) {
            case "google" -> {
                log.info("Factory: Creating Google embedding strategy");
                log.info("   Model: {}", model);
                yield new GoogleEmbeddingsService(apiKey, baseUrl, model, timeout);
            }
            default -> throw new IllegalArgumentException(
                    "Unsupported embedding provider: '" + provider + "'. " +
                            "Supported providers: google. " +
                            "Set 'meditwin.embedding.provider' in application.yml.");
        };
    }
}
