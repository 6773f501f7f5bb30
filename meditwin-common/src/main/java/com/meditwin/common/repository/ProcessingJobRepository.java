package com.meditwin.common.repository;

import com.meditwin.common.entity.ProcessingJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ProcessingJobRepository extends JpaRepository<ProcessingJob, String> {

    // Ownership check: status is only visible to the patient who submitted the document
    Optional<ProcessingJob> findByDocumentIdAndPatientId(String documentId, String patientId);

    List<ProcessingJob> findByPatientIdOrderByCreatedAtDesc(String patientId);

    long countByStatus(ProcessingJob.JobStatus status);

    /**
     * QUEUED to PROCESSING in one statement, so a cancel and a worker can never both win.
     *
     * @return 1 when this caller claimed the job, 0 when it was no longer queued
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE ProcessingJob j SET j.status = com.meditwin.common.entity.ProcessingJob.JobStatus.PROCESSING, "
            + "j.startedAt = :now, j.updatedAt = :now, j.version = j.version + 1 "
            + "WHERE j.documentId = :documentId "
            + "AND j.status = com.meditwin.common.entity.ProcessingJob.JobStatus.QUEUED")
    int claimQueued(@Param("documentId") String documentId, @Param("now") LocalDateTime now);

    /**
     * QUEUED to CANCELLED for the owning patient only.
     *
     * @return 1 when the job was cancelled, 0 when it was not queued or belongs to someone else
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("UPDATE ProcessingJob j SET j.status = com.meditwin.common.entity.ProcessingJob.JobStatus.CANCELLED, "
            + "j.statusMessage = :message, j.updatedAt = :now, j.version = j.version + 1 "
            + "WHERE j.documentId = :documentId AND j.patientId = :patientId "
            + "AND j.status = com.meditwin.common.entity.ProcessingJob.JobStatus.QUEUED")
    int cancelQueued(@Param("documentId") String documentId,
            @Param("patientId") String patientId,
            @Param("message") String message,
            @Param("now") LocalDateTime now);

    @Transactional
    long deleteByPatientId(String patientId);
}
