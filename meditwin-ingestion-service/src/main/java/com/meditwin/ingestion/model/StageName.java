package com.meditwin.ingestion.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stage keys used in {@link ProcessingResult#stages()}.
 */
public enum StageName {
    IDENTITY("identity"),
    TEXT_EXTRACTION("text_extraction"),
    SECTION_PARSING("section_parsing"),
    CLINICAL_EXTRACTION("clinical_extraction"),
    CHUNKING("chunking"),
    VECTOR_EMBEDDING("vector_embedding"),
    STORAGE_COORDINATION("storage_coordination");

    private final String key;

    StageName(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }
}
