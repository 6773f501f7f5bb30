package com.meditwin.ingestion.storage;

import com.meditwin.common.identity.PatientIdentityManager;
import com.meditwin.ingestion.audit.AuditLogger;
import com.meditwin.ingestion.model.ClinicalRecord;
import com.meditwin.ingestion.model.EmbeddingRecord;
import com.meditwin.ingestion.model.StageResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans a finished record out to every storage backend concurrently. Each write is independent and
 * bounded by one shared deadline; one backend failing never prevents the others. A write still running
 * at the deadline is cancelled with an interrupt so its pool thread is handed back. Storage succeeds
 * when at least one of the document, graph and vector stores accepted the data.
 */
@Slf4j
@Component
public class StorageCoordinator {

    private final Map<BackendType, StorageBackend> backends;
    private final ExecutorService executor;
    private final long backendTimeoutSeconds;
    private final PatientIdentityManager identityManager;
    private final AuditLogger auditLogger;

    public StorageCoordinator(List<StorageBackend> backends,
            @Qualifier("storageExecutor") ExecutorService executor,
            @Value("${meditwin.timeouts.backend-seconds:30}") long backendTimeoutSeconds,
            PatientIdentityManager identityManager,
            AuditLogger auditLogger) {
        Map<BackendType, StorageBackend> byType = new EnumMap<>(BackendType.class);
        for (StorageBackend backend : backends) {
            if (byType.put(backend.type(), backend) != null) {
                throw new IllegalStateException("Duplicate storage backend for " + backend.type());
            }
        }
        this.backends = Collections.unmodifiableMap(byType);
        this.executor = executor;
        this.backendTimeoutSeconds = backendTimeoutSeconds;
        this.identityManager = identityManager;
        this.auditLogger = auditLogger;
    }

    public StageResult<StorageReport> store(ClinicalRecord record, List<EmbeddingRecord> embeddings) {
        Map<BackendType, BackendOutcome> outcomes = new EnumMap<>(BackendType.class);
        Map<BackendType, Future<Long>> pending = new EnumMap<>(BackendType.class);

        for (BackendType type : BackendType.values()) {
            StorageBackend backend = backends.get(type);
            if (backend == null) {
                outcomes.put(type, BackendOutcome.skipped(type, "Backend not configured"));
            } else if (type == BackendType.VECTOR && embeddings.isEmpty()) {
                outcomes.put(type, BackendOutcome.skipped(type, "No embeddings to store"));
            } else {
                Callable<Long> write = () -> backend.store(record, embeddings);
                pending.put(type, executor.submit(write));
            }
        }

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(backendTimeoutSeconds);
        pending.forEach((type, future) -> outcomes.put(type, await(type, future, deadline)));

        StorageReport report = new StorageReport(outcomes);
        report.outcomes().values().forEach(outcome -> {
            if (outcome.status() == BackendOutcome.Status.FAILED) {
                log.warn("   {} failed for {}: {}", outcome.backend().key(),
                        identityManager.anonymizeForLog(record.patientId()), outcome.error());
            } else {
                log.info("   {} -> {} ({} items)", outcome.backend().key(), outcome.status(), outcome.itemsWritten());
            }
        });
        auditLogger.storageCompleted(record.patientId(), record.documentId(), report);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("successfulBackends", report.successfulBackends());
        details.put("totalBackends", report.totalBackends());
        Map<String, Object> perBackend = new LinkedHashMap<>();
        report.outcomes().values().forEach(outcome -> perBackend.put(outcome.backend().key(), outcome));
        details.put("backends", perBackend);

        if (!report.isSuccess()) {
            return StageResult.failed("All storage backends failed", details);
        }
        return StageResult.success(report, details);
    }

    public Collection<StorageBackend> getBackends() {
        return backends.values();
    }

    private BackendOutcome await(BackendType type, Future<Long> write, long deadline) {
        try {
            long items = write.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            return BackendOutcome.succeeded(type, items);
        } catch (TimeoutException e) {
            write.cancel(true);
            return BackendOutcome.failed(type, "Timed out after " + backendTimeoutSeconds + "s");
        } catch (ExecutionException e) {
            return BackendOutcome.failed(type, describe(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            write.cancel(true);
            return BackendOutcome.failed(type, "Interrupted while waiting for the write");
        }
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "Unknown error";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
