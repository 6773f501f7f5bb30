package com.meditwin.common.entity;

import jakarta.persistence.*;
import java.time.LocalDateTime;

/**
 * Persisted status of one document run. Status endpoints only ever read the stored result copy.
 */
@Entity
@Table(name = "processing_jobs", indexes = {
        @Index(name = "idx_job_patient_id", columnList = "patient_id"),
        @Index(name = "idx_job_status", columnList = "status"),
        @Index(name = "idx_job_created_at", columnList = "created_at")
})
public class ProcessingJob {

    public static final String CANCELLED_MESSAGE = "Cancelled before processing started";

    @Id
    @Column(name = "document_id", length = 64)
    private String documentId;

    @Column(name = "patient_id", nullable = false, length = 32)
    private String patientId; // Pseudonymous PT_ identifier, never the caller id

    @Column(name = "original_filename", length = 255)
    private String originalFilename;

    @Column(name = "file_size")
    private Long fileSize;

    @Column(name = "temp_path", length = 500)
    private String tempPath;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_mode", nullable = false, length = 20)
    private ProcessingMode processingMode;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private JobStatus status = JobStatus.QUEUED;

    @Column(name = "status_message", length = 500)
    private String statusMessage;

    @Column(name = "result_json", columnDefinition = "TEXT")
    private String resultJson;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Version
    @Column(name = "version")
    private Long version;

    public enum JobStatus {
        QUEUED, // Accepted, waiting for a worker
        PROCESSING, // A worker owns the document
        COMPLETED, // Run finished with at least one backend updated
        FAILED, // Run finished in the Failed state
        CANCELLED // Withdrawn before a worker started it
    }

    public enum ProcessingMode {
        SYNCHRONOUS,
        BACKGROUND
    }

    public ProcessingJob() {
        this.createdAt = LocalDateTime.now();
        this.updatedAt = LocalDateTime.now();
    }

    public ProcessingJob(String documentId, String patientId, String originalFilename, Long fileSize,
            String tempPath, ProcessingMode processingMode) {
        this();
        this.documentId = documentId;
        this.patientId = patientId;
        this.originalFilename = originalFilename;
        this.fileSize = fileSize;
        this.tempPath = tempPath;
        this.processingMode = processingMode;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = LocalDateTime.now();
    }

    // Business Logic Methods
    public void markAsProcessing() {
        this.status = JobStatus.PROCESSING;
        this.startedAt = LocalDateTime.now();
        this.updatedAt = LocalDateTime.now();
    }

    public void markAsCompleted(String resultJson, String message) {
        finish(JobStatus.COMPLETED, resultJson, message);
    }

    public void markAsFailed(String resultJson, String message) {
        finish(JobStatus.FAILED, resultJson, message);
    }

    private void finish(JobStatus finalStatus, String resultJson, String message) {
        this.status = finalStatus;
        this.resultJson = resultJson;
        this.statusMessage = message;
        this.completedAt = LocalDateTime.now();
        this.updatedAt = LocalDateTime.now();
    }

    // Helper Methods
    public boolean canBeCancelled() {
        return JobStatus.QUEUED.equals(this.status);
    }

    public boolean isFinished() {
        return JobStatus.COMPLETED.equals(this.status) || JobStatus.FAILED.equals(this.status);
    }

    public String getDocumentId() {
        return documentId;
    }

    public void setDocumentId(String documentId) {
        this.documentId = documentId;
    }

    public String getPatientId() {
        return patientId;
    }

    public void setPatientId(String patientId) {
        this.patientId = patientId;
    }

    public String getOriginalFilename() {
        return originalFilename;
    }

    public void setOriginalFilename(String originalFilename) {
        this.originalFilename = originalFilename;
    }

    public Long getFileSize() {
        return fileSize;
    }

    public void setFileSize(Long fileSize) {
        this.fileSize = fileSize;
    }

    public String getTempPath() {
        return tempPath;
    }

    public void setTempPath(String tempPath) {
        this.tempPath = tempPath;
    }

    public ProcessingMode getProcessingMode() {
        return processingMode;
    }

    public void setProcessingMode(ProcessingMode processingMode) {
        this.processingMode = processingMode;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public String getStatusMessage() {
        return statusMessage;
    }

    public void setStatusMessage(String statusMessage) {
        this.statusMessage = statusMessage;
    }

    public String getResultJson() {
        return resultJson;
    }

    public void setResultJson(String resultJson) {
        this.resultJson = resultJson;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(LocalDateTime createdAt) {
        this.createdAt = createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(LocalDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }

    public LocalDateTime getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(LocalDateTime startedAt) {
        this.startedAt = startedAt;
    }

    public LocalDateTime getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(LocalDateTime completedAt) {
        this.completedAt = completedAt;
    }

    public Long getVersion() {
        return version;
    }

    @Override
    public String toString() {
        return "ProcessingJob{" +
                "documentId='" + documentId + '\'' +
                ", processingMode=" + processingMode +
                ", status=" + status +
                ", createdAt=" + createdAt +
                '}';
    }
}
