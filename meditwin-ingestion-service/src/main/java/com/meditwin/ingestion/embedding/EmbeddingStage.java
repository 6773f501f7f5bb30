package com.meditwin.ingestion.embedding;

import com.meditwin.ingestion.embedding.strategy.EmbeddingStrategy;
import com.meditwin.ingestion.model.EmbeddingRecord;
import com.meditwin.ingestion.model.StageResult;
import com.meditwin.ingestion.model.TextChunk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Embeds chunks in fixed-size batches and pairs each vector with its chunk by position. Any provider
 * error fails the whole stage; the orchestrator carries on without vectors.
 */
@Slf4j
@Component
public class EmbeddingStage {

    private final EmbeddingStrategy embeddingStrategy;
    private final int batchSize;

    public EmbeddingStage(EmbeddingStrategy embeddingStrategy,
            @Value("${meditwin.embedding.batch-size:10}") int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("meditwin.embedding.batch-size must be > 0");
        }
        this.embeddingStrategy = embeddingStrategy;
        this.batchSize = batchSize;
    }

    public StageResult<List<EmbeddingRecord>> embed(List<TextChunk> chunks) {
        if (chunks.isEmpty()) {
            return StageResult.success(List.of(), Map.of("embeddingsCreated", 0));
        }

        List<EmbeddingRecord> records = new ArrayList<>(chunks.size());
        int batchCount = 0;
        for (int from = 0; from < chunks.size(); from += batchSize) {
            List<TextChunk> batch = chunks.subList(from, Math.min(from + batchSize, chunks.size()));
            batchCount++;

            EmbeddingStrategy.EmbeddingResult result;
            try {
                result = embeddingStrategy.generateEmbeddings(batch.stream().map(TextChunk::text).toList());
            } catch (EmbeddingProviderException e) {
                result = EmbeddingStrategy.EmbeddingResult.failed(e.getMessage());
            } catch (RuntimeException e) {
                // Client exception text can carry request URIs and credentials
                log.debug("   Embedding provider threw", e);
                result = EmbeddingStrategy.EmbeddingResult.failed(e.getClass().getSimpleName());
            }

            if (!result.isSuccessful()) {
                log.warn("   Embedding batch {} failed: {}", batchCount, result.getErrorMessage());
                return StageResult.failed("Embedding provider error: " + result.getErrorMessage(),
                        Map.of("provider", embeddingStrategy.getProviderName(), "failedBatch", batchCount));
            }
            if (result.getCount() != batch.size()) {
                return StageResult.failed("Embedding count mismatch in batch " + batchCount
                        + ": expected " + batch.size() + ", got " + result.getCount());
            }

            for (int i = 0; i < batch.size(); i++) {
                records.add(EmbeddingRecord.of(batch.get(i), result.getEmbeddings().get(i)));
            }
        }

        log.info("   Embedded {} chunks in {} batch(es) via {}", records.size(), batchCount,
                embeddingStrategy.getProviderName());
        return StageResult.success(records, Map.of(
                "embeddingsCreated", records.size(),
                "batches", batchCount,
                "provider", embeddingStrategy.getProviderName()));
    }
}
