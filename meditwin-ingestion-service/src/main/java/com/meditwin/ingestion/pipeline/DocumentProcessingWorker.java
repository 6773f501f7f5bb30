package com.meditwin.ingestion.pipeline;

import com.meditwin.ingestion.model.ProcessingResult;
import com.meditwin.ingestion.model.RawDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Owns one document run end to end. Whatever happens inside the pipeline, the caller gets a
 * ProcessingResult back and the temporary file is gone afterwards.
 */
@Slf4j
@Component
public class DocumentProcessingWorker {

    private final PipelineOrchestrator orchestrator;
    private final TemporaryDocumentStore temporaryStore;

    public DocumentProcessingWorker(PipelineOrchestrator orchestrator, TemporaryDocumentStore temporaryStore) {
        this.orchestrator = orchestrator;
        this.temporaryStore = temporaryStore;
    }

    public ProcessingResult run(RawDocument document) {
        long start = System.currentTimeMillis();
        try {
            return orchestrator.process(document);
        } catch (Throwable e) {
            // Native OCR bindings and page rendering can fail with an Error rather than an Exception
            log.error("Unexpected failure processing {}: {}", document.documentId(), e.getMessage(), e);
            return ProcessingResult.unexpectedFailure(document.documentId(), System.currentTimeMillis() - start);
        } finally {
            temporaryStore.delete(document.filePath());
        }
    }
}
