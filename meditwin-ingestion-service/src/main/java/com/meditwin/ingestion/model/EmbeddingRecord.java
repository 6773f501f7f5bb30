package com.meditwin.ingestion.model;

/**
 * Vector for one successfully embedded chunk. The chunk text travels along for vector store metadata.
 */
public record EmbeddingRecord(String chunkId, float[] vector, String text, ChunkMetadata metadata) {

    public static EmbeddingRecord of(TextChunk chunk, float[] vector) {
        return new EmbeddingRecord(chunk.chunkId(), vector, chunk.text(), chunk.metadata());
    }

    public int dimensions() {
        return vector == null ? 0 : vector.length;
    }
}
