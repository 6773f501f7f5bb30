package com.meditwin.ingestion.model;

public record TextChunk(String chunkId, String text, ChunkMetadata metadata) {
}
