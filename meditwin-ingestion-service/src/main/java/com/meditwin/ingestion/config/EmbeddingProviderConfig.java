package com.meditwin.ingestion.config;

import com.meditwin.ingestion.embedding.strategy.EmbeddingStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Selects the embedding provider from 'meditwin.embedding.provider' and registers it as the
 * EmbeddingStrategy bean. Switching providers = change one config value, restart app.
 */
@Slf4j
@Configuration
public class EmbeddingProviderConfig {

    @Value("${meditwin.embedding.provider:google}")
    private String embeddingProvider;

    @Value("${meditwin.timeouts.embedding-seconds:30}")
    private long embeddingTimeoutSeconds;

    // ═══════════════════════════════════════════════════════
    // Google Configuration
    // ═══════════════════════════════════════════════════════

    @Value("${google.embeddings.api-key:}")
    private String googleEmbeddingsApiKey;

    @Value("${google.embeddings.base-url:https://generativelanguage.googleapis.com/v1beta}")
    private String googleEmbeddingsBaseUrl;

    @Value("${google.embeddings.model:gemini-embedding-001}")
    private String googleEmbeddingsModel;

    @Bean
    public EmbeddingStrategy embeddingStrategy() {
        log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━");
        log.info("CONFIGURING EMBEDDING PROVIDER");
        log.info("   Selected provider: {}", embeddingProvider);

        String apiKey;
        String baseUrl;
        String model;

        switch (embeddingProvider.toLowerCase()) {
            case "google" -> {
                apiKey = googleEmbeddingsApiKey;
                baseUrl = googleEmbeddingsBaseUrl;
                model = googleEmbeddingsModel;
            }
            default -> throw new IllegalArgumentException(
                    "Unknown embedding provider: " + embeddingProvider);
        }

        EmbeddingStrategy strategy = EmbeddingProviderFactory.createEmbeddingGenerator(
                embeddingProvider, apiKey, baseUrl, model, Duration.ofSeconds(embeddingTimeoutSeconds));

        log.info("   Active provider: {}", strategy.getProviderName());
        log.info("   Dimensions: {}", strategy.getDimensions());
        log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━");

        return strategy;
    }
}
