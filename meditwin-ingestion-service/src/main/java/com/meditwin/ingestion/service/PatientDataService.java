package com.meditwin.ingestion.service;

import com.meditwin.common.identity.PatientIdentityManager;
import com.meditwin.common.repository.ProcessingJobRepository;
import com.meditwin.ingestion.audit.AuditLogger;
import com.meditwin.ingestion.storage.BackendOutcome;
import com.meditwin.ingestion.storage.BackendType;
import com.meditwin.ingestion.storage.StorageBackend;
import com.meditwin.ingestion.storage.StorageCoordinator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Patient-scoped reads and erasure across every backend.
 */
@Slf4j
@Service
public class PatientDataService {

    private final StorageCoordinator storageCoordinator;
    private final ProcessingJobRepository jobRepository;
    private final PatientIdentityManager identityManager;
    private final AuditLogger auditLogger;

    public PatientDataService(StorageCoordinator storageCoordinator,
            ProcessingJobRepository jobRepository,
            PatientIdentityManager identityManager,
            AuditLogger auditLogger) {
        this.storageCoordinator = storageCoordinator;
        this.jobRepository = jobRepository;
        this.identityManager = identityManager;
        this.auditLogger = auditLogger;
    }

    /**
     * Document ids held in the canonical document store, newest first.
     */
    public List<String> listRecords(String callerId) {
        String patientId = identityManager.deriveId(callerId);
        return storageCoordinator.getBackends().stream()
                .filter(backend -> backend.type() == BackendType.DOCUMENT)
                .findFirst()
                .map(backend -> backend.listKeys(patientId))
                .orElse(List.of());
    }

    /**
     * Erase the patient from every backend and drop their job history. A failing backend is reported
     * and does not stop the others.
     *
     * @return items removed per backend key, plus "jobs"
     */
    public Map<String, Object> deleteAll(String callerId) {
        String patientId = identityManager.deriveId(callerId);
        Map<BackendType, BackendOutcome> outcomes = new EnumMap<>(BackendType.class);

        for (StorageBackend backend : storageCoordinator.getBackends()) {
            try {
                outcomes.put(backend.type(),
                        BackendOutcome.succeeded(backend.type(), backend.deleteAllForPatient(patientId)));
            } catch (RuntimeException e) {
                log.error("Deleting patient data from {} failed: {}", backend.type().key(), e.getMessage());
                outcomes.put(backend.type(), BackendOutcome.failed(backend.type(), "Deletion failed"));
            }
        }
        long jobs = jobRepository.deleteByPatientId(patientId);
        auditLogger.patientDataDeleted(patientId, outcomes);

        Map<String, Object> report = new LinkedHashMap<>();
        outcomes.values().forEach(outcome -> report.put(outcome.backend().key(), outcome));
        report.put("jobs", jobs);
        return report;
    }
}
