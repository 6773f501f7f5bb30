package com.meditwin.ingestion.pipeline;

import com.meditwin.ingestion.model.PipelineState;
import com.meditwin.ingestion.model.ProcessingResult;
import com.meditwin.ingestion.model.ProcessingSummary;
import com.meditwin.ingestion.model.RawDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DocumentProcessingWorker: temporary file cleanup and the catch-all result.
 */
@ExtendWith(MockitoExtension.class)
class DocumentProcessingWorkerTest {

    @Mock
    private PipelineOrchestrator orchestrator;

    @TempDir
    Path tempDir;

    private DocumentProcessingWorker worker;
    private RawDocument document;

    @BeforeEach
    void setUp() throws IOException {
        TemporaryDocumentStore temporaryStore = new TemporaryDocumentStore(tempDir.toString());
        worker = new DocumentProcessingWorker(orchestrator, temporaryStore);
        Path file = Files.writeString(temporaryStore.pathFor("doc-1"), "%PDF-1.4");
        document = new RawDocument(file, "doc-1", "caller-123", Map.of());
    }

    @Test
    @DisplayName("Should return the pipeline result and delete the temporary file")
    void run_shouldDeleteTempFileAfterSuccess() {
        ProcessingResult completed = new ProcessingResult("doc-1", "PT_X", true, PipelineState.COMPLETED,
                "Document processed successfully", Map.of(), ProcessingSummary.empty(), 12);
        when(orchestrator.process(document)).thenReturn(completed);

        assertSame(completed, worker.run(document));
        assertFalse(Files.exists(document.filePath()));
    }

    @Test
    @DisplayName("Should turn an unexpected exception into a generic failed result")
    void run_shouldCatchUnexpectedFailures() {
        when(orchestrator.process(any())).thenThrow(new IllegalStateException("secret internal detail"));

        ProcessingResult result = worker.run(document);

        assertFalse(result.success());
        assertEquals(PipelineState.FAILED, result.finalState());
        assertEquals(ProcessingResult.GENERIC_FAILURE_MESSAGE, result.message());
        assertFalse(result.message().contains("secret"));
        assertFalse(Files.exists(document.filePath()));
    }

    @Test
    @DisplayName("Should turn a native library error into a generic failed result")
    void run_shouldCatchLinkageErrors() {
        when(orchestrator.process(any())).thenThrow(new UnsatisfiedLinkError("no tesseract in java.library.path"));

        ProcessingResult result = worker.run(document);

        assertFalse(result.success());
        assertEquals(ProcessingResult.GENERIC_FAILURE_MESSAGE, result.message());
        assertFalse(Files.exists(document.filePath()));
    }
}
