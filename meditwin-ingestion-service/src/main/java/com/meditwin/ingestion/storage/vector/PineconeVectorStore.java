package com.meditwin.ingestion.storage.vector;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meditwin.common.identity.PatientIdentityManager;
import com.meditwin.ingestion.model.ClinicalRecord;
import com.meditwin.ingestion.model.EmbeddingRecord;
import com.meditwin.ingestion.storage.BackendType;
import com.meditwin.ingestion.storage.StorageBackend;
import com.meditwin.ingestion.storage.StorageBackendException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Pinecone REST client. Each patient gets its own namespace named after the store-specific patient
 * key, so vectors never carry the patient id and deletion is a single namespace wipe.
 */
@Slf4j
@Component
public class PineconeVectorStore implements StorageBackend {

    static final int UPSERT_BATCH_SIZE = 100;

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final PatientIdentityManager identityManager;
    private final String apiKey;
    private final String indexName;
    private final String baseUrl;
    private final int metadataTextLimit;
    private final String storeSalt;
    private final Duration timeout;

    public PineconeVectorStore(PatientIdentityManager identityManager,
            @Value("${pinecone.api-key}") String apiKey,
            @Value("${pinecone.index-name}") String indexName,
            @Value("${pinecone.base-url}") String baseUrl,
            @Value("${pinecone.metadata-text-limit:1000}") int metadataTextLimit,
            @Value("${meditwin.identity.store-salts.vector:}") String storeSalt,
            @Value("${meditwin.timeouts.backend-seconds:30}") long timeoutSeconds) {
        this.identityManager = identityManager;
        this.apiKey = apiKey;
        this.indexName = indexName;
        this.baseUrl = baseUrl;
        this.metadataTextLimit = metadataTextLimit;
        this.storeSalt = storeSalt;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
        this.webClient = WebClient.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(10 * 1024 * 1024))
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public BackendType type() {
        return BackendType.VECTOR;
    }

    @Override
    public long store(ClinicalRecord record, List<EmbeddingRecord> embeddings) {
        String namespace = namespace(record.patientId());
        long storedAt = System.currentTimeMillis();

        List<Map<String, Object>> vectors = new ArrayList<>(embeddings.size());
        for (EmbeddingRecord embedding : embeddings) {
            vectors.add(toVector(embedding, storedAt));
        }

        long upserted = 0;
        for (int start = 0; start < vectors.size(); start += UPSERT_BATCH_SIZE) {
            List<Map<String, Object>> batch = vectors.subList(start, Math.min(start + UPSERT_BATCH_SIZE, vectors.size()));
            JsonNode response = post("/vectors/upsert", Map.of("vectors", batch, "namespace", namespace));
            upserted += response.path("upsertedCount").asLong(batch.size());
        }
        log.debug("Upserted {} vectors into index {}", upserted, indexName);
        return upserted;
    }

    /** Stored metadata of one chunk */
    @Override
    public Optional<Map<String, Object>> get(String patientId, String chunkId) {
        String uri = UriComponentsBuilder.fromHttpUrl(baseUrl + "/vectors/fetch")
                .queryParam("ids", chunkId)
                .queryParam("namespace", namespace(patientId))
                .toUriString();
        JsonNode vector = getJson(uri).path("vectors").path(chunkId);
        if (vector.isMissingNode()) {
            return Optional.empty();
        }
        JsonNode metadata = vector.path("metadata");
        return Optional.of(metadata.isObject() ? objectMapper.convertValue(metadata, METADATA_TYPE) : Map.<String, Object>of());
    }

    @Override
    public List<String> listKeys(String patientId) {
        String namespace = namespace(patientId);
        List<String> ids = new ArrayList<>();
        String paginationToken = null;
        do {
            UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(baseUrl + "/vectors/list")
                    .queryParam("namespace", namespace);
            if (paginationToken != null) {
                uri.queryParam("paginationToken", paginationToken);
            }
            JsonNode page = getJson(uri.toUriString());
            page.path("vectors").forEach(vector -> ids.add(vector.path("id").asText()));
            paginationToken = page.path("pagination").path("next").asText(null);
        } while (paginationToken != null && !paginationToken.isBlank());
        return ids;
    }

    @Override
    public long deleteAllForPatient(String patientId) {
        int existing = listKeys(patientId).size();
        if (existing == 0) {
            return 0;
        }
        post("/vectors/delete", Map.of("deleteAll", true, "namespace", namespace(patientId)));
        return existing;
    }

    /**
     * Test Pinecone connection via index stats
     */
    public boolean testConnection() {
        try {
            JsonNode stats = post("/describe_index_stats", Map.of());
            log.debug("Pinecone index stats: {}", stats);
            return true;
        } catch (StorageBackendException e) {
            log.error("Pinecone connection failed: {}", e.getMessage());
            return false;
        }
    }

    public Map<String, Object> getStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("vector_store", "Pinecone");
        stats.put("index_name", indexName);
        stats.put("namespacing", "per patient");
        return stats;
    }

    Map<String, Object> toVector(EmbeddingRecord embedding, long storedAt) {
        List<Float> values = new ArrayList<>(embedding.dimensions());
        for (float value : embedding.vector()) {
            values.add(value);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("document_id", embedding.metadata().documentId());
        metadata.put("section", embedding.metadata().section());
        metadata.put("chunk_type", embedding.metadata().chunkType().label());
        metadata.put("chunk_index", embedding.metadata().index());
        metadata.put("text", truncate(embedding.text()));
        metadata.put("stored_at", String.valueOf(storedAt));

        return Map.of("id", embedding.chunkId(), "values", values, "metadata", metadata);
    }

    private String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= metadataTextLimit ? text : text.substring(0, metadataTextLimit);
    }

    private String namespace(String patientId) {
        return identityManager.rehashForStore(patientId, storeSalt);
    }

    private JsonNode post(String path, Map<String, Object> body) {
        try {
            String response = webClient.post()
                    .uri(baseUrl + path)
                    .header("Api-Key", apiKey)
                    .header("Content-Type", "application/json")
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
            return objectMapper.readTree(response == null || response.isBlank() ? "{}" : response);
        } catch (Exception e) {
            throw new StorageBackendException(type(), "Pinecone request " + path + " failed: " + e.getMessage(), e);
        }
    }

    private JsonNode getJson(String uri) {
        try {
            String response = webClient.get()
                    .uri(uri)
                    .header("Api-Key", apiKey)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
            return objectMapper.readTree(response == null || response.isBlank() ? "{}" : response);
        } catch (Exception e) {
            throw new StorageBackendException(type(), "Pinecone request failed: " + e.getMessage(), e);
        }
    }
}
