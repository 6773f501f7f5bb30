package com.meditwin.ingestion.audit;

import com.meditwin.common.identity.PatientIdentityManager;
import com.meditwin.ingestion.model.ProcessingResult;
import com.meditwin.ingestion.storage.BackendOutcome;
import com.meditwin.ingestion.storage.BackendType;
import com.meditwin.ingestion.storage.StorageReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Audit trail on its own logger topic so it can be routed separately. Patient ids are always
 * anonymized.
 */
@Slf4j(topic = "meditwin.audit")
@Component
public class AuditLogger {

    private final PatientIdentityManager identityManager;

    public AuditLogger(PatientIdentityManager identityManager) {
        this.identityManager = identityManager;
    }

    public void storageCompleted(String patientId, String documentId, StorageReport report) {
        String outcomes = report.outcomes().values().stream()
                .map(outcome -> outcome.backend().key() + "=" + outcome.status())
                .collect(Collectors.joining(","));
        log.info("action=store_clinical_record patient={} document={} success={} backends={}/{} outcomes=[{}]",
                identityManager.anonymizeForLog(patientId), documentId, report.isSuccess(),
                report.successfulBackends(), report.totalBackends(), outcomes);
    }

    public void runFinished(ProcessingResult result) {
        log.info("action=process_document patient={} document={} success={} state={} durationMs={}",
                identityManager.anonymizeForLog(result.patientId()), result.documentId(), result.success(),
                result.finalState(), result.durationMs());
    }

    public void patientDataDeleted(String patientId, Map<BackendType, BackendOutcome> outcomes) {
        String summary = outcomes.values().stream()
                .map(outcome -> outcome.backend().key() + "=" + outcome.status() + "(" + outcome.itemsWritten() + ")")
                .collect(Collectors.joining(","));
        log.info("action=delete_patient_data patient={} outcomes=[{}]",
                identityManager.anonymizeForLog(patientId), summary);
    }
}
