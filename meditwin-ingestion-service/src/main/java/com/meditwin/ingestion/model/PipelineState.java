package com.meditwin.ingestion.model;

/**
 * States a document run moves through. Completed and Failed are terminal.
 */
public enum PipelineState {
    IDLE,
    EXTRACTING,
    PARSING,
    ENTITY_EXTRACTING,
    EMBEDDING,
    STORING_DATA,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
