package com.meditwin.ingestion.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meditwin.ingestion.embedding.strategy.EmbeddingStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Google Embeddings implementation of EmbeddingStrategy
 *
 * - Uses the batchEmbedContents endpoint, one HTTP call per batch
 * - No @Service annotation, instantiated by EmbeddingProviderFactory
 * - gemini-embedding-001 produces 3072-dimensional vectors
 * - The API key travels in a header, and failures are reported without request details
 */
@Slf4j
public class GoogleEmbeddingsService implements EmbeddingStrategy {

    static final int DIMENSIONS = 3072;
    static final String API_KEY_HEADER = "x-goog-api-key";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String baseUrl;
    private final String model;
    private final Duration timeout;

    public GoogleEmbeddingsService(String apiKey, String baseUrl, String model, Duration timeout) {
        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
        this.model = model;
        this.timeout = timeout;
        this.webClient = WebClient.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String getProviderName() {
        return "Google Embeddings (" + model + ")";
    }

    @Override
    public int getDimensions() {
        return DIMENSIONS;
    }

    @Override
    public EmbeddingResult generateEmbeddings(List<String> texts) {
        if (texts.isEmpty()) {
            return EmbeddingResult.success(List.of());
        }
        try {
            log.debug("[{}] Embedding batch of {} texts", getProviderName(), texts.size());

            List<Map<String, Object>> requests = new ArrayList<>(texts.size());
            for (String text : texts) {
                requests.add(Map.of(
                        "model", "models/" + model,
                        "content", Map.of("parts", List.of(Map.of("text", text)))));
            }

            String response = webClient
                    .post()
                    .uri(baseUrl + "/models/" + model + ":batchEmbedContents")
                    .header(API_KEY_HEADER, apiKey)
                    .header("Content-Type", "application/json")
                    .bodyValue(Map.of("requests", requests))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();

            List<float[]> vectors = parseBatchResponse(response);
            if (vectors.size() != texts.size()) {
                throw new EmbeddingProviderException(
                        "Provider returned " + vectors.size() + " embeddings for " + texts.size() + " texts");
            }
            return EmbeddingResult.success(vectors);

        } catch (Exception e) {
            String reason = describeFailure(e);
            log.error("[{}] Failed to generate embeddings: {}", getProviderName(), reason);
            return EmbeddingResult.failed("Embedding generation failed: " + reason);
        }
    }

    /**
     * Status code or failure kind only. Client exception messages carry the request URI and headers.
     */
    static String describeFailure(Throwable error) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof WebClientResponseException response) {
                return "HTTP " + response.getStatusCode().value();
            }
            if (cause instanceof WebClientRequestException) {
                return "provider unreachable";
            }
            if (cause instanceof TimeoutException) {
                return "request timed out";
            }
            if (cause instanceof EmbeddingProviderException) {
                return cause.getMessage();
            }
        }
        return error.getClass().getSimpleName();
    }

    /**
     * Parse {"embeddings":[{"values":[...]}, ...]} into vectors, in order
     */
    List<float[]> parseBatchResponse(String response) {
        JsonNode embeddings;
        try {
            embeddings = objectMapper.readTree(response == null ? "" : response).path("embeddings");
        } catch (Exception e) {
            throw new EmbeddingProviderException("Unparseable embedding response", e);
        }
        if (!embeddings.isArray() || embeddings.isEmpty()) {
            throw new EmbeddingProviderException("No embeddings in response");
        }

        List<float[]> vectors = new ArrayList<>(embeddings.size());
        for (JsonNode embedding : embeddings) {
            JsonNode values = embedding.path("values");
            if (!values.isArray() || values.isEmpty()) {
                throw new EmbeddingProviderException("Embedding without values in response");
            }
            float[] vector = new float[values.size()];
            for (int i = 0; i < values.size(); i++) {
                vector[i] = (float) values.get(i).asDouble();
            }
            vectors.add(vector);
        }
        return vectors;
    }
}
