package com.meditwin.ingestion.model;

import java.nio.file.Path;
import java.util.Map;

/**
 * A validated document waiting for a run. The file is transient and removed when the run ends.
 * Synchronous uploads carry the caller identifier; background runs carry the patient id derived
 * when the job was submitted.
 */
public record RawDocument(
        Path filePath,
        String documentId,
        String callerId,
        String patientId,
        Map<String, String> metadata
) {
    public RawDocument {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public RawDocument(Path filePath, String documentId, String callerId, Map<String, String> metadata) {
        this(filePath, documentId, callerId, null, metadata);
    }

    public static RawDocument forPatient(Path filePath, String documentId, String patientId,
            Map<String, String> metadata) {
        return new RawDocument(filePath, documentId, null, patientId, metadata);
    }
}
