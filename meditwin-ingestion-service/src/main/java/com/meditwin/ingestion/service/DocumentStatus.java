package com.meditwin.ingestion.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.meditwin.ingestion.model.ProcessingSummary;

/**
 * What a caller sees about one document: a status value, a human-readable message and, once the run
 * finished, its summary counts. Never carries stage internals or identifiers beyond the document id.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DocumentStatus(
        String documentId,
        String status,
        String message,
        ProcessingSummary summary,
        Long durationMs
) {
    public static final String COMPLETED = "completed";
    public static final String FAILED = "failed";
    public static final String PROCESSING = "processing";
    public static final String CANCELLED = "cancelled";
    public static final String NOT_FOUND = "not_found";

    public static DocumentStatus notFound(String documentId) {
        return new DocumentStatus(documentId, NOT_FOUND, "Document not found", null, null);
    }

    public boolean isCompleted() {
        return COMPLETED.equals(status);
    }
}
