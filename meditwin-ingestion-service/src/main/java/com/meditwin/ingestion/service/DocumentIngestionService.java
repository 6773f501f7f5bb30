package com.meditwin.ingestion.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meditwin.common.entity.ProcessingJob;
import com.meditwin.common.entity.ProcessingJob.ProcessingMode;
import com.meditwin.common.identity.PatientIdentityManager;
import com.meditwin.common.repository.ProcessingJobRepository;
import com.meditwin.ingestion.model.ProcessingResult;
import com.meditwin.ingestion.model.ProcessingSummary;
import com.meditwin.ingestion.model.RawDocument;
import com.meditwin.ingestion.pipeline.DocumentProcessingWorker;
import com.meditwin.ingestion.pipeline.DocumentValidator;
import com.meditwin.ingestion.pipeline.TemporaryDocumentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for uploads. Synchronous requests run the pipeline on the request thread; background
 * requests are persisted as QUEUED jobs and handed to RabbitMQ. Every job is owned by the patient id
 * derived from the caller, and status lookups for another patient's job read as not found.
 */
@Slf4j
@Service
public class DocumentIngestionService {

    private final DocumentValidator validator;
    private final TemporaryDocumentStore temporaryStore;
    private final DocumentProcessingWorker worker;
    private final DocumentProcessingPublisher publisher;
    private final ProcessingJobRepository jobRepository;
    private final PatientIdentityManager identityManager;
    private final ObjectMapper objectMapper;

    public DocumentIngestionService(DocumentValidator validator,
            TemporaryDocumentStore temporaryStore,
            DocumentProcessingWorker worker,
            DocumentProcessingPublisher publisher,
            ProcessingJobRepository jobRepository,
            PatientIdentityManager identityManager,
            ObjectMapper objectMapper) {
        this.validator = validator;
        this.temporaryStore = temporaryStore;
        this.worker = worker;
        this.publisher = publisher;
        this.jobRepository = jobRepository;
        this.identityManager = identityManager;
        this.objectMapper = objectMapper;
    }

    /**
     * Validate, run the whole pipeline and return the outcome.
     */
    public DocumentStatus process(MultipartFile file, String callerId) {
        validator.validate(file, ProcessingMode.SYNCHRONOUS);
        String patientId = identityManager.deriveId(callerId);
        String documentId = UUID.randomUUID().toString();

        Path tempPath = temporaryStore.save(documentId, file);
        ProcessingJob job = new ProcessingJob(documentId, patientId, file.getOriginalFilename(), file.getSize(),
                tempPath.toString(), ProcessingMode.SYNCHRONOUS);
        job.markAsProcessing();
        jobRepository.save(job);

        log.info("Synchronous processing of {} for {}", documentId, identityManager.anonymizeForLog(patientId));
        ProcessingResult result = worker.run(new RawDocument(tempPath, documentId, callerId, metadataFor(file)));
        recordResult(job, result);
        return toStatus(job);
    }

    /**
     * Validate, park the file and enqueue a background job.
     */
    public DocumentStatus submit(MultipartFile file, String callerId) {
        validator.validate(file, ProcessingMode.BACKGROUND);
        String patientId = identityManager.deriveId(callerId);
        String documentId = UUID.randomUUID().toString();

        Path tempPath = temporaryStore.save(documentId, file);
        ProcessingJob job = jobRepository.save(new ProcessingJob(documentId, patientId, file.getOriginalFilename(),
                file.getSize(), tempPath.toString(), ProcessingMode.BACKGROUND));

        try {
            publisher.queueForProcessing(job, metadataFor(file));
        } catch (RuntimeException e) {
            temporaryStore.delete(tempPath);
            job.markAsFailed(null, "Could not queue document for processing");
            jobRepository.save(job);
            throw e;
        }

        log.info("Queued {} for {}", documentId, identityManager.anonymizeForLog(patientId));
        return toStatus(job);
    }

    public DocumentStatus getStatus(String documentId, String callerId) {
        String patientId = identityManager.deriveId(callerId);
        return jobRepository.findByDocumentIdAndPatientId(documentId, patientId)
                .map(this::toStatus)
                .orElseGet(() -> DocumentStatus.notFound(documentId));
    }

    /**
     * Withdraw a job no worker has started yet. The status change is a conditional update, so a
     * worker claiming the job at the same moment either wins outright or finds it cancelled.
     *
     * @return the job status afterwards; a job already running or finished is returned unchanged
     */
    public DocumentStatus cancel(String documentId, String callerId) {
        String patientId = identityManager.deriveId(callerId);
        Optional<ProcessingJob> found = jobRepository.findByDocumentIdAndPatientId(documentId, patientId);
        if (found.isEmpty()) {
            return DocumentStatus.notFound(documentId);
        }

        ProcessingJob job = found.get();
        if (!job.canBeCancelled()) {
            return toStatus(job);
        }

        int cancelled = jobRepository.cancelQueued(documentId, patientId, ProcessingJob.CANCELLED_MESSAGE,
                LocalDateTime.now());
        if (cancelled == 0) {
            log.info("Document {} was claimed before it could be cancelled", documentId);
            return jobRepository.findByDocumentIdAndPatientId(documentId, patientId)
                    .map(this::toStatus)
                    .orElseGet(() -> DocumentStatus.notFound(documentId));
        }

        if (job.getTempPath() != null) {
            temporaryStore.delete(Path.of(job.getTempPath()));
        }
        log.info("Cancelled queued document {}", documentId);
        return new DocumentStatus(documentId, DocumentStatus.CANCELLED, ProcessingJob.CANCELLED_MESSAGE, null, null);
    }

    /**
     * Move a queued job to PROCESSING for a background worker.
     *
     * @return the job, or empty when it was cancelled or already taken
     */
    public Optional<ProcessingJob> claim(String documentId) {
        if (jobRepository.claimQueued(documentId, LocalDateTime.now()) == 0) {
            return Optional.empty();
        }
        return jobRepository.findById(documentId);
    }

    /**
     * Persist the finished run so status polling only ever reads this copy.
     */
    public void recordResult(ProcessingJob job, ProcessingResult result) {
        String json = serialize(result);
        if (result.success()) {
            job.markAsCompleted(json, result.message());
        } else {
            job.markAsFailed(json, result.message());
        }
        jobRepository.save(job);
    }

    DocumentStatus toStatus(ProcessingJob job) {
        return switch (job.getStatus()) {
            case QUEUED -> new DocumentStatus(job.getDocumentId(), DocumentStatus.PROCESSING,
                    "Queued for processing", null, null);
            case PROCESSING -> new DocumentStatus(job.getDocumentId(), DocumentStatus.PROCESSING,
                    "Processing", null, null);
            case CANCELLED -> new DocumentStatus(job.getDocumentId(), DocumentStatus.CANCELLED,
                    job.getStatusMessage(), null, null);
            case COMPLETED -> finishedStatus(job, DocumentStatus.COMPLETED);
            case FAILED -> finishedStatus(job, DocumentStatus.FAILED);
        };
    }

    private DocumentStatus finishedStatus(ProcessingJob job, String status) {
        ProcessingSummary summary = null;
        Long durationMs = null;
        if (job.getResultJson() != null) {
            try {
                JsonNode result = objectMapper.readTree(job.getResultJson());
                summary = objectMapper.treeToValue(result.path("summary"), ProcessingSummary.class);
                durationMs = result.path("durationMs").asLong();
            } catch (JsonProcessingException e) {
                log.warn("Stored result for {} is unreadable: {}", job.getDocumentId(), e.getMessage());
            }
        }
        return new DocumentStatus(job.getDocumentId(), status, job.getStatusMessage(), summary, durationMs);
    }

    private String serialize(ProcessingResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            log.error("Could not serialize result for {}: {}", result.documentId(), e.getMessage());
            return null;
        }
    }

    private static Map<String, String> metadataFor(MultipartFile file) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("originalFilename", String.valueOf(file.getOriginalFilename()));
        metadata.put("contentType", String.valueOf(file.getContentType()));
        metadata.put("fileSize", String.valueOf(file.getSize()));
        metadata.put("receivedAt", Instant.now().toString());
        return metadata;
    }
}
