package com.meditwin.ingestion.pipeline;

import com.meditwin.common.identity.InvalidCallerIdException;
import com.meditwin.common.identity.PatientIdentityManager;
import com.meditwin.ingestion.audit.AuditLogger;
import com.meditwin.ingestion.chunking.ClinicalTextChunker;
import com.meditwin.ingestion.clinical.ClinicalEntityExtractor;
import com.meditwin.ingestion.embedding.EmbeddingStage;
import com.meditwin.ingestion.extraction.SectionParser;
import com.meditwin.ingestion.extraction.TextExtractor;
import com.meditwin.ingestion.model.ClinicalRecord;
import com.meditwin.ingestion.model.EmbeddingRecord;
import com.meditwin.ingestion.model.ExtractedText;
import com.meditwin.ingestion.model.PipelineState;
import com.meditwin.ingestion.model.ProcessingResult;
import com.meditwin.ingestion.model.ProcessingSummary;
import com.meditwin.ingestion.model.RawDocument;
import com.meditwin.ingestion.model.StageName;
import com.meditwin.ingestion.model.StageResult;
import com.meditwin.ingestion.model.TextChunk;
import com.meditwin.ingestion.storage.BackendType;
import com.meditwin.ingestion.storage.StorageCoordinator;
import com.meditwin.ingestion.storage.StorageReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one document through every stage in order:
 *
 * Identity → Extract text → Parse sections → Extract facts → Chunk → Embed → Store → Result
 *
 * Extraction failure or empty text ends the run as Failed. Embedding failure is recorded and the run
 * continues without vectors. Storage fails the run only when no backend accepted the record.
 */
@Slf4j
@Service
public class PipelineOrchestrator {

    static final String SUCCESS_MESSAGE = "Document processed successfully";
    static final String INVALID_CALLER_MESSAGE = "Invalid caller identifier";
    static final String EXTRACTION_FAILED_MESSAGE = "Text extraction failed";
    static final String NO_TEXT_MESSAGE = "No text could be extracted from document";
    static final String STORAGE_FAILED_MESSAGE = "All storage backends failed";

    private final PatientIdentityManager identityManager;
    private final TextExtractor textExtractor;
    private final SectionParser sectionParser;
    private final ClinicalEntityExtractor entityExtractor;
    private final ClinicalTextChunker chunker;
    private final EmbeddingStage embeddingStage;
    private final StorageCoordinator storageCoordinator;
    private final AuditLogger auditLogger;

    public PipelineOrchestrator(PatientIdentityManager identityManager,
            TextExtractor textExtractor,
            SectionParser sectionParser,
            ClinicalEntityExtractor entityExtractor,
            ClinicalTextChunker chunker,
            EmbeddingStage embeddingStage,
            StorageCoordinator storageCoordinator,
            AuditLogger auditLogger) {
        this.identityManager = identityManager;
        this.textExtractor = textExtractor;
        this.sectionParser = sectionParser;
        this.entityExtractor = entityExtractor;
        this.chunker = chunker;
        this.embeddingStage = embeddingStage;
        this.storageCoordinator = storageCoordinator;
        this.auditLogger = auditLogger;
    }

    public ProcessingResult process(RawDocument document) {
        Run run = new Run(document.documentId());

        log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━");
        log.info("CLINICAL DOCUMENT PIPELINE");
        log.info("Document ID: {}", document.documentId());

        // 1. Identity
        log.info("STEP 1: Deriving patient identity...");
        try {
            run.patientId = resolvePatientId(document);
        } catch (InvalidCallerIdException e) {
            run.record(StageName.IDENTITY, StageResult.failed(e.getMessage()));
            return run.fail(INVALID_CALLER_MESSAGE, ProcessingSummary.empty());
        }
        String anonymized = identityManager.anonymizeForLog(run.patientId);
        run.record(StageName.IDENTITY, StageResult.success(run.patientId, Map.of("patient", anonymized)));
        log.info("   Patient: {}", anonymized);

        // 2. Text extraction
        run.state = PipelineState.EXTRACTING;
        log.info("STEP 2: Extracting text...");
        StageResult<ExtractedText> extraction = textExtractor.extract(document.filePath());
        if (!extraction.isSuccess()) {
            run.record(StageName.TEXT_EXTRACTION, extraction);
            return run.fail(EXTRACTION_FAILED_MESSAGE, ProcessingSummary.empty());
        }
        ExtractedText extracted = extraction.getPayload();
        if (extracted.isEmpty()) {
            run.record(StageName.TEXT_EXTRACTION,
                    StageResult.<ExtractedText>failed(NO_TEXT_MESSAGE, extraction.getDetails()));
            return run.fail(NO_TEXT_MESSAGE, ProcessingSummary.empty());
        }
        run.record(StageName.TEXT_EXTRACTION, extraction);
        int textLength = extracted.fullText().length();
        log.info("   Extracted {} characters from {} pages ({})", textLength,
                extracted.metadata().pageCount(), extracted.metadata().method());

        // 3. Sections
        run.state = PipelineState.PARSING;
        log.info("STEP 3: Parsing sections...");
        Map<String, String> sections = sectionParser.parse(extracted.fullText());
        extracted = extracted.withSections(sections);
        run.record(StageName.SECTION_PARSING,
                StageResult.success(sections, Map.of("sectionsFound", List.copyOf(sections.keySet()))));
        log.info("   Sections: {}", sections.keySet());

        // 4. Clinical facts
        run.state = PipelineState.ENTITY_EXTRACTING;
        log.info("STEP 4: Extracting clinical entities...");
        StageResult<ClinicalRecord> entities = entityExtractor.extract(
                extracted, run.patientId, document.documentId(), document.metadata());
        run.record(StageName.CLINICAL_EXTRACTION, entities);
        ClinicalRecord record = entities.getPayload();

        // 5. Chunking and embedding
        run.state = PipelineState.EMBEDDING;
        log.info("STEP 5: Chunking and embedding...");
        StageResult<List<TextChunk>> chunking = chunker.chunk(record);
        run.record(StageName.CHUNKING, chunking);
        List<TextChunk> chunks = chunking.isSuccess() ? chunking.getPayload() : List.of();

        StageResult<List<EmbeddingRecord>> embedding = embeddingStage.embed(chunks);
        run.record(StageName.VECTOR_EMBEDDING, embedding);
        List<EmbeddingRecord> embeddings = List.of();
        if (embedding.isSuccess()) {
            embeddings = embedding.getPayload();
            log.info("   {} chunks, {} embeddings", chunks.size(), embeddings.size());
        } else {
            log.warn("   Embedding failed, continuing without vectors: {}", embedding.getError());
        }

        // 6. Storage
        run.state = PipelineState.STORING_DATA;
        log.info("STEP 6: Storing across backends...");
        StageResult<StorageReport> storage = storageCoordinator.store(record, embeddings);
        run.record(StageName.STORAGE_COORDINATION, storage);

        if (!storage.isSuccess()) {
            return run.fail(STORAGE_FAILED_MESSAGE, summarize(textLength, record, 0, 0));
        }
        StorageReport report = storage.getPayload();
        ProcessingSummary summary = summarize(textLength, record,
                (int) report.itemsWritten(BackendType.VECTOR), report.successfulBackends());
        log.info("   Stores updated: {}/{}", report.successfulBackends(), report.totalBackends());

        return run.complete(summary);
    }

    /**
     * Background runs arrive with the id derived at submission; synchronous runs derive it here.
     */
    private String resolvePatientId(RawDocument document) {
        if (document.patientId() == null) {
            return identityManager.deriveId(document.callerId());
        }
        if (!identityManager.validateFormat(document.patientId())) {
            throw new InvalidCallerIdException("Malformed patient identifier");
        }
        return document.patientId();
    }

    private static ProcessingSummary summarize(int textLength, ClinicalRecord record,
            int embeddingsStored, int storesUpdated) {
        return new ProcessingSummary(
                textLength,
                record.injuries().size(),
                record.diagnoses().size(),
                record.procedures().size(),
                record.medications().size(),
                embeddingsStored,
                storesUpdated);
    }

    /**
     * Mutable bookkeeping for one run; the ProcessingResult it produces is immutable.
     */
    private final class Run {

        private final String documentId;
        private final long startNanos = System.nanoTime();
        private final Map<StageName, StageResult<?>> stages = new LinkedHashMap<>();
        private PipelineState state = PipelineState.IDLE;
        private String patientId;

        private Run(String documentId) {
            this.documentId = documentId;
        }

        private void record(StageName stage, StageResult<?> result) {
            stages.put(stage, result);
        }

        private ProcessingResult fail(String message, ProcessingSummary summary) {
            log.error("PIPELINE FAILED in {}: {}", state, message);
            return finish(false, PipelineState.FAILED, message, summary);
        }

        private ProcessingResult complete(ProcessingSummary summary) {
            ProcessingResult result = finish(true, PipelineState.COMPLETED, SUCCESS_MESSAGE, summary);
            log.info("PIPELINE COMPLETE in {} ms", result.durationMs());
            log.info("━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━");
            return result;
        }

        private ProcessingResult finish(boolean success, PipelineState finalState, String message,
                ProcessingSummary summary) {
            state = finalState;
            long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
            ProcessingResult result = new ProcessingResult(documentId, patientId, success, finalState,
                    message, stages, summary, durationMs);
            auditLogger.runFinished(result);
            return result;
        }
    }
}
