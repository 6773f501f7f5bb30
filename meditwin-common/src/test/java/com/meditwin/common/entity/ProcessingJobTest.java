package com.meditwin.common.entity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProcessingJobTest {

    private ProcessingJob newJob() {
        return new ProcessingJob("doc-1", "PT_0123456789ABCDEF", "note.pdf", 1024L,
                "/tmp/doc-1.pdf", ProcessingJob.ProcessingMode.BACKGROUND);
    }

    @Test
    @DisplayName("Should start queued and be cancellable")
    void newJob_shouldBeQueuedAndCancellable() {
        ProcessingJob job = newJob();

        assertEquals(ProcessingJob.JobStatus.QUEUED, job.getStatus());
        assertTrue(job.canBeCancelled());
        assertFalse(job.isFinished());
    }

    @Test
    @DisplayName("Should not be cancellable once a worker started it")
    void processingJob_shouldNotBeCancellable() {
        ProcessingJob job = newJob();
        job.markAsProcessing();

        assertFalse(job.canBeCancelled());
        assertNotNull(job.getStartedAt());
    }

    @Test
    @DisplayName("Should keep the result copy when completed")
    void markAsCompleted_shouldStoreResult() {
        ProcessingJob job = newJob();
        job.markAsProcessing();
        job.markAsCompleted("{\"success\":true}", "Document processed");

        assertTrue(job.isFinished());
        assertEquals("{\"success\":true}", job.getResultJson());
        assertNotNull(job.getCompletedAt());
    }
}
