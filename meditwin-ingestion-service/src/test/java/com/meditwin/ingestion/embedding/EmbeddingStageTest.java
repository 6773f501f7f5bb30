package com.meditwin.ingestion.embedding;

import com.meditwin.ingestion.embedding.strategy.EmbeddingStrategy;
import com.meditwin.ingestion.model.ChunkMetadata;
import com.meditwin.ingestion.model.ChunkType;
import com.meditwin.ingestion.model.EmbeddingRecord;
import com.meditwin.ingestion.model.StageResult;
import com.meditwin.ingestion.model.TextChunk;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

/**
 * Unit tests for EmbeddingStage: batching, chunk/vector pairing and provider failures.
 */
@ExtendWith(MockitoExtension.class)
class EmbeddingStageTest {

    @Mock
    private EmbeddingStrategy embeddingStrategy;

    private static List<TextChunk> chunks(int count) {
        List<TextChunk> chunks = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            chunks.add(new TextChunk("doc-1_subjective_" + i, "chunk text " + i,
                    new ChunkMetadata("patient-key", "doc-1", "subjective", ChunkType.SOAP_SECTION, i)));
        }
        return chunks;
    }

    private static EmbeddingStrategy.EmbeddingResult vectors(int count) {
        List<float[]> vectors = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            vectors.add(new float[]{i, i + 0.5f});
        }
        return EmbeddingStrategy.EmbeddingResult.success(vectors);
    }

    @Test
    @DisplayName("Should embed in batches and pair vectors with chunks by position")
    void embed_shouldBatchAndPair() {
        when(embeddingStrategy.getProviderName()).thenReturn("test-provider");
        when(embeddingStrategy.generateEmbeddings(anyList()))
                .thenReturn(vectors(2))
                .thenReturn(vectors(1));

        StageResult<List<EmbeddingRecord>> result = new EmbeddingStage(embeddingStrategy, 2).embed(chunks(3));

        assertTrue(result.isSuccess());
        assertEquals(3, result.getPayload().size());
        assertEquals("doc-1_subjective_2", result.getPayload().get(2).chunkId());
        assertEquals("chunk text 1", result.getPayload().get(1).text());
        assertEquals(2, result.getPayload().get(0).dimensions());
        assertEquals(2, result.getDetails().get("batches"));
        verify(embeddingStrategy, times(2)).generateEmbeddings(anyList());
    }

    @Test
    @DisplayName("Should fail the stage when the provider reports an error")
    void embed_shouldFailOnProviderError() {
        when(embeddingStrategy.getProviderName()).thenReturn("test-provider");
        when(embeddingStrategy.generateEmbeddings(anyList()))
                .thenReturn(EmbeddingStrategy.EmbeddingResult.failed("quota exceeded"));

        StageResult<List<EmbeddingRecord>> result = new EmbeddingStage(embeddingStrategy, 10).embed(chunks(3));

        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("quota exceeded"));
    }

    @Test
    @DisplayName("Should fail the stage when the provider throws")
    void embed_shouldFailOnProviderException() {
        when(embeddingStrategy.getProviderName()).thenReturn("test-provider");
        when(embeddingStrategy.generateEmbeddings(anyList()))
                .thenThrow(new IllegalStateException("POST https://embeddings.example/v1?key=secret-key failed"));

        StageResult<List<EmbeddingRecord>> result = new EmbeddingStage(embeddingStrategy, 10).embed(chunks(1));

        assertFalse(result.isSuccess());
        assertEquals("Embedding provider error: IllegalStateException", result.getError());
        assertFalse(result.getError().contains("secret-key"));
    }

    @Test
    @DisplayName("Should fail the stage when the vector count does not match the batch")
    void embed_shouldFailOnCountMismatch() {
        when(embeddingStrategy.generateEmbeddings(anyList())).thenReturn(vectors(1));

        StageResult<List<EmbeddingRecord>> result = new EmbeddingStage(embeddingStrategy, 10).embed(chunks(2));

        assertFalse(result.isSuccess());
        assertTrue(result.getError().startsWith("Embedding count mismatch"));
    }

    @Test
    @DisplayName("Should succeed without calling the provider for no chunks")
    void embed_shouldSkipEmptyInput() {
        StageResult<List<EmbeddingRecord>> result = new EmbeddingStage(embeddingStrategy, 10).embed(List.of());

        assertTrue(result.isSuccess());
        assertTrue(result.getPayload().isEmpty());
        verifyNoInteractions(embeddingStrategy);
    }
}
