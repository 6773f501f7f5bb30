package com.meditwin.ingestion.chunking;

import com.meditwin.ingestion.model.ChunkMetadata;
import com.meditwin.ingestion.model.ChunkType;
import com.meditwin.ingestion.model.ClinicalRecord;
import com.meditwin.ingestion.model.StageResult;
import com.meditwin.ingestion.model.TextChunk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Splits section texts, narratives and fact summaries into retrieval-sized chunks.
 *
 * Text within {@code maxChunkSize} stays whole. Longer text is cut at sentence boundaries; every chunk
 * after the first is seeded with the tail of its predecessor so that no chunk exceeds
 * {@code maxChunkSize + overlapSize}, apart from a single sentence that is longer than that on its own.
 */
@Slf4j
@Component
public class ClinicalTextChunker {

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+|\\n+");

    private final int maxChunkSize;
    private final int overlapSize;

    public ClinicalTextChunker(
            @Value("${meditwin.chunking.max-chunk-size:300}") int maxChunkSize,
            @Value("${meditwin.chunking.overlap-size:50}") int overlapSize) {
        if (maxChunkSize <= 0) {
            throw new IllegalArgumentException("meditwin.chunking.max-chunk-size must be > 0");
        }
        if (overlapSize < 0 || overlapSize >= maxChunkSize) {
            throw new IllegalArgumentException(
                    "meditwin.chunking.overlap-size must be >= 0 and < max-chunk-size");
        }
        this.maxChunkSize = maxChunkSize;
        this.overlapSize = overlapSize;
    }

    /**
     * Pure over the record; always succeeds.
     */
    public StageResult<List<TextChunk>> chunk(ClinicalRecord record) {
        List<TextChunk> chunks = new ArrayList<>();
        int soapChunks = 0;
        int narrativeChunks = 0;
        int summaryChunks = 0;

        for (String section : ClinicalRecord.SOAP_SECTIONS) {
            soapChunks += addChunks(chunks, record, section, ChunkType.SOAP_SECTION,
                    record.sectionTexts().get(section));
        }
        for (String narrative : ClinicalRecord.NARRATIVES) {
            narrativeChunks += addChunks(chunks, record, narrative, ChunkType.NARRATIVE,
                    record.narrativeTexts().get(narrative));
        }
        for (Map.Entry<String, String> summary : FactSummaryWriter.summarize(record).entrySet()) {
            summaryChunks += addChunks(chunks, record, summary.getKey(), ChunkType.STRUCTURED_SUMMARY,
                    summary.getValue());
        }

        log.info("   Created {} chunks ({} section, {} narrative, {} summary)",
                chunks.size(), soapChunks, narrativeChunks, summaryChunks);

        return StageResult.success(chunks, Map.of(
                "chunksCreated", chunks.size(),
                "soapChunks", soapChunks,
                "narrativeChunks", narrativeChunks,
                "summaryChunks", summaryChunks));
    }

    private int addChunks(List<TextChunk> chunks, ClinicalRecord record, String section, ChunkType type,
            String text) {
        if (!ClinicalRecord.isAvailable(text)) {
            return 0;
        }
        List<String> pieces = splitText(text);
        for (int index = 0; index < pieces.size(); index++) {
            String chunkId = record.documentId() + "_" + section + "_" + chunks.size();
            ChunkMetadata metadata = new ChunkMetadata(record.patientId(), record.documentId(), section, type, index);
            chunks.add(new TextChunk(chunkId, pieces.get(index), metadata));
        }
        return pieces.size();
    }

    /**
     * Split one text into bounded pieces. Returns the trimmed input unchanged when it already fits.
     */
    public List<String> splitText(String text) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        if (trimmed.length() <= maxChunkSize) {
            return List.of(trimmed);
        }

        List<String> sentences = Arrays.stream(SENTENCE_BOUNDARY.split(trimmed))
                .map(String::trim)
                .filter(sentence -> !sentence.isEmpty())
                .toList();

        List<String> pieces = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String sentence : sentences) {
            if (current.length() == 0) {
                current.append(sentence);
            } else if (current.length() + 1 + sentence.length() <= maxChunkSize) {
                current.append(' ').append(sentence);
            } else {
                String previous = current.toString();
                pieces.add(previous);
                current = new StringBuilder();
                String seed = overlapTail(previous, sentence.length());
                if (!seed.isEmpty()) {
                    current.append(seed).append(' ');
                }
                current.append(sentence);
            }
        }
        if (current.length() > 0) {
            pieces.add(current.toString());
        }
        return pieces;
    }

    /** Tail of the previous piece, shortened so that tail + ' ' + next stays within the bound */
    private String overlapTail(String previous, int nextLength) {
        int room = maxChunkSize + overlapSize - 1 - nextLength;
        int tailLength = Math.min(overlapSize, Math.min(room, previous.length()));
        if (tailLength <= 0) {
            return "";
        }
        return previous.substring(previous.length() - tailLength).trim();
    }

    public int getMaxChunkSize() {
        return maxChunkSize;
    }

    public int getOverlapSize() {
        return overlapSize;
    }
}
