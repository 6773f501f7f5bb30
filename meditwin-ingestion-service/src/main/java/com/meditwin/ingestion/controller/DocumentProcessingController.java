package com.meditwin.ingestion.controller;

import com.meditwin.common.dto.ApiResponse;
import com.meditwin.ingestion.service.DocumentIngestionService;
import com.meditwin.ingestion.service.DocumentStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

/**
 * Document processing endpoints. The caller is identified by the X-Caller-Id header set by the edge.
 */
@Slf4j
@RestController
@RequestMapping("/documents")
public class DocumentProcessingController {

    static final String CALLER_HEADER = "X-Caller-Id";

    private final DocumentIngestionService ingestionService;

    public DocumentProcessingController(DocumentIngestionService ingestionService) {
        this.ingestionService = ingestionService;
    }

    /**
     * Process a document synchronously
     */
    @PostMapping("/process")
    public ResponseEntity<ApiResponse<DocumentStatus>> processDocument(
            @RequestHeader(CALLER_HEADER) String callerId,
            @RequestParam("file") MultipartFile file) {

        DocumentStatus status = ingestionService.process(file, callerId);

        if (status.isCompleted()) {
            return ResponseEntity.ok(ApiResponse.success(status, status.message()));
        }
        return ResponseEntity.unprocessableEntity()
                .body(ApiResponse.failed(status, status.message(), HttpStatus.UNPROCESSABLE_ENTITY.value()));
    }

    /**
     * Queue a document for background processing
     */
    @PostMapping("/process/async")
    public ResponseEntity<ApiResponse<DocumentStatus>> submitDocument(
            @RequestHeader(CALLER_HEADER) String callerId,
            @RequestParam("file") MultipartFile file) {

        DocumentStatus status = ingestionService.submit(file, callerId);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ApiResponse.accepted(status, "Document queued for processing"));
    }

    /**
     * Poll the status of a document
     */
    @GetMapping("/status/{documentId}")
    public ResponseEntity<ApiResponse<DocumentStatus>> getStatus(
            @RequestHeader(CALLER_HEADER) String callerId,
            @PathVariable(name = "documentId") String documentId) {

        DocumentStatus status = ingestionService.getStatus(documentId, callerId);
        if (DocumentStatus.NOT_FOUND.equals(status.status())) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ApiResponse.failed(status, status.message(), HttpStatus.NOT_FOUND.value()));
        }
        return ResponseEntity.ok(ApiResponse.success(status, status.message()));
    }

    /**
     * Cancel a queued document that has not started
     */
    @DeleteMapping("/queue/{documentId}")
    public ResponseEntity<ApiResponse<DocumentStatus>> cancel(
            @RequestHeader(CALLER_HEADER) String callerId,
            @PathVariable(name = "documentId") String documentId) {

        DocumentStatus status = ingestionService.cancel(documentId, callerId);
        return switch (status.status()) {
            case DocumentStatus.CANCELLED -> ResponseEntity.ok(ApiResponse.success(status, "Document cancelled"));
            case DocumentStatus.NOT_FOUND -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ApiResponse.failed(status, status.message(), HttpStatus.NOT_FOUND.value()));
            default -> ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(ApiResponse.failed(status, "Document is already " + status.status(),
                            HttpStatus.CONFLICT.value()));
        };
    }
}
