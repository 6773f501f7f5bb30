package com.meditwin.ingestion.controller;

import com.meditwin.common.exception.DocumentValidationException;
import com.meditwin.common.exception.GlobalExceptionHandler;
import com.meditwin.ingestion.model.ProcessingSummary;
import com.meditwin.ingestion.service.DocumentIngestionService;
import com.meditwin.ingestion.service.DocumentStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Unit tests for DocumentProcessingController: HTTP status mapping of document outcomes.
 */
@ExtendWith(MockitoExtension.class)
class DocumentProcessingControllerTest {

    private static final String CALLER_ID = "caller-123";

    @Mock
    private DocumentIngestionService ingestionService;

    private MockMvc mockMvc;
    private final MockMultipartFile file =
            new MockMultipartFile("file", "note.pdf", "application/pdf", "%PDF-1.4".getBytes());

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new DocumentProcessingController(ingestionService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Should return 200 with the summary for a completed document")
    void processDocument_shouldReturnOkWhenCompleted() throws Exception {
        when(ingestionService.process(any(), eq(CALLER_ID))).thenReturn(new DocumentStatus("doc-1",
                DocumentStatus.COMPLETED, "Document processed successfully",
                new ProcessingSummary(500, 1, 1, 0, 1, 4, 3), 120L));

        mockMvc.perform(multipart("/documents/process").file(file).header("X-Caller-Id", CALLER_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.status").value("completed"))
                .andExpect(jsonPath("$.data.summary.storesUpdated").value(3));
    }

    @Test
    @DisplayName("Should return 422 when the pipeline failed")
    void processDocument_shouldReturnUnprocessableWhenFailed() throws Exception {
        when(ingestionService.process(any(), eq(CALLER_ID))).thenReturn(new DocumentStatus("doc-1",
                DocumentStatus.FAILED, "No text could be extracted from document", ProcessingSummary.empty(), 30L));

        mockMvc.perform(multipart("/documents/process").file(file).header("X-Caller-Id", CALLER_ID))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("No text could be extracted from document"));
    }

    @Test
    @DisplayName("Should return 400 for a rejected upload")
    void processDocument_shouldReturnBadRequestForInvalidFile() throws Exception {
        when(ingestionService.process(any(), eq(CALLER_ID)))
                .thenThrow(new DocumentValidationException("Unsupported file type. Supported: .pdf"));

        mockMvc.perform(multipart("/documents/process").file(file).header("X-Caller-Id", CALLER_ID))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unsupported file type. Supported: .pdf"));
    }

    @Test
    @DisplayName("Should return 202 for a queued document")
    void submitDocument_shouldReturnAccepted() throws Exception {
        when(ingestionService.submit(any(), eq(CALLER_ID))).thenReturn(new DocumentStatus("doc-1",
                DocumentStatus.PROCESSING, "Queued for processing", null, null));

        mockMvc.perform(multipart("/documents/process/async").file(file).header("X-Caller-Id", CALLER_ID))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.data.documentId").value("doc-1"));
    }

    @Test
    @DisplayName("Should return 404 for an unknown or foreign document")
    void getStatus_shouldReturnNotFound() throws Exception {
        when(ingestionService.getStatus("doc-9", CALLER_ID)).thenReturn(DocumentStatus.notFound("doc-9"));

        mockMvc.perform(get("/documents/status/doc-9").header("X-Caller-Id", CALLER_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.data.status").value("not_found"));
    }

    @Test
    @DisplayName("Should return 409 when cancelling a document that already started")
    void cancel_shouldReturnConflictForRunningDocument() throws Exception {
        when(ingestionService.cancel("doc-1", CALLER_ID)).thenReturn(new DocumentStatus("doc-1",
                DocumentStatus.PROCESSING, "Processing", null, null));

        mockMvc.perform(delete("/documents/queue/doc-1").header("X-Caller-Id", CALLER_ID))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message").value("Document is already processing"));
    }

    @Test
    @DisplayName("Should return 400 without the caller header")
    void getStatus_shouldRequireCallerHeader() throws Exception {
        mockMvc.perform(get("/documents/status/doc-1"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(ingestionService);
    }
}
