package com.meditwin.ingestion.model;

public record ChunkMetadata(
        String patientId,
        String documentId,
        String section,
        ChunkType chunkType,
        int index
) {
}
