package com.meditwin.common.message;

import com.meditwin.common.entity.ProcessingJob;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Queue payload for a background run. The file already sits in the worker-visible temp directory.
 * Only the pseudonymous patient id travels through the broker, never the caller identifier.
 */
public record DocumentProcessingMessage(
        String documentId,
        String patientId,
        String originalFilename,
        String tempPath,
        Long fileSize,
        Map<String, String> metadata,
        LocalDateTime createdAt
) {
    public static DocumentProcessingMessage from(ProcessingJob job, Map<String, String> metadata) {
        return new DocumentProcessingMessage(
                job.getDocumentId(),
                job.getPatientId(),
                job.getOriginalFilename(),
                job.getTempPath(),
                job.getFileSize(),
                metadata == null ? Map.of() : Map.copyOf(metadata),
                job.getCreatedAt()
        );
    }
}
