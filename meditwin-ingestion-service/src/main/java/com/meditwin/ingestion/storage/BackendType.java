package com.meditwin.ingestion.storage;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The storage systems a record fans out to. Only the first three decide whether storage succeeded;
 * the profile store is best effort.
 */
public enum BackendType {
    DOCUMENT("document_store", true),
    GRAPH("graph_store", true),
    VECTOR("vector_store", true),
    PROFILE("profile_store", false);

    private final String key;
    private final boolean countsTowardSuccess;

    BackendType(String key, boolean countsTowardSuccess) {
        this.key = key;
        this.countsTowardSuccess = countsTowardSuccess;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public boolean countsTowardSuccess() {
        return countsTowardSuccess;
    }
}
