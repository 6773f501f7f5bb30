package com.meditwin.ingestion.storage;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-backend outcomes of one storage fan-out. Skipped backends (for example the vector store when no
 * embeddings were produced) count neither as attempted nor as failed.
 */
public record StorageReport(Map<BackendType, BackendOutcome> outcomes) {

    public StorageReport {
        Map<BackendType, BackendOutcome> copy = new EnumMap<>(BackendType.class);
        copy.putAll(outcomes);
        outcomes = Collections.unmodifiableMap(copy);
    }

    @JsonProperty("successfulBackends")
    public int successfulBackends() {
        return (int) outcomes.values().stream()
                .filter(outcome -> outcome.backend().countsTowardSuccess())
                .filter(BackendOutcome::isSucceeded)
                .count();
    }

    @JsonProperty("totalBackends")
    public int totalBackends() {
        return (int) outcomes.values().stream()
                .filter(outcome -> outcome.backend().countsTowardSuccess())
                .filter(outcome -> outcome.status() != BackendOutcome.Status.SKIPPED)
                .count();
    }

    @JsonProperty("success")
    public boolean isSuccess() {
        return successfulBackends() > 0;
    }

    public Optional<BackendOutcome> outcome(BackendType backend) {
        return Optional.ofNullable(outcomes.get(backend));
    }

    public long itemsWritten(BackendType backend) {
        return outcome(backend).filter(BackendOutcome::isSucceeded).map(BackendOutcome::itemsWritten).orElse(0L);
    }
}
