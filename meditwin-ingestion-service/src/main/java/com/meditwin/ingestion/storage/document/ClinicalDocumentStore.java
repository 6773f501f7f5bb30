package com.meditwin.ingestion.storage.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meditwin.common.entity.ClinicalRecordEntity;
import com.meditwin.common.identity.PatientIdentityManager;
import com.meditwin.common.repository.ClinicalRecordRepository;
import com.meditwin.ingestion.model.ClinicalRecord;
import com.meditwin.ingestion.model.EmbeddingRecord;
import com.meditwin.ingestion.storage.BackendType;
import com.meditwin.ingestion.storage.StorageBackend;
import com.meditwin.ingestion.storage.StorageBackendException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical store: the full clinical record as JSON, one row per (patient, document).
 */
@Slf4j
@Component
public class ClinicalDocumentStore implements StorageBackend {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ClinicalRecordRepository recordRepository;
    private final ObjectMapper objectMapper;
    private final PatientIdentityManager identityManager;
    private final String storeSalt;

    public ClinicalDocumentStore(ClinicalRecordRepository recordRepository,
            ObjectMapper objectMapper,
            PatientIdentityManager identityManager,
            @Value("${meditwin.identity.store-salts.document:}") String storeSalt) {
        this.recordRepository = recordRepository;
        this.objectMapper = objectMapper;
        this.identityManager = identityManager;
        this.storeSalt = storeSalt;
    }

    @Override
    public BackendType type() {
        return BackendType.DOCUMENT;
    }

    @Override
    @Transactional
    public long store(ClinicalRecord record, List<EmbeddingRecord> embeddings) {
        String patientKey = patientKey(record.patientId());
        try {
            String json = objectMapper.writeValueAsString(record.withPatientId(patientKey));

            ClinicalRecordEntity entity = recordRepository
                    .findByPatientKeyAndDocumentId(patientKey, record.documentId())
                    .map(existing -> {
                        existing.replaceContent(record.documentTitle(), record.documentDate(), json);
                        return existing;
                    })
                    .orElseGet(() -> new ClinicalRecordEntity(patientKey, record.documentId(),
                            record.documentTitle(), record.documentDate(), json));

            recordRepository.save(entity);
            return 1;

        } catch (JsonProcessingException e) {
            throw new StorageBackendException(type(), "Failed to serialize clinical record", e);
        } catch (DataAccessException e) {
            throw new StorageBackendException(type(), "Failed to save clinical record", e);
        }
    }

    /** Stored record for a document, as a JSON map */
    @Override
    public Optional<Map<String, Object>> get(String patientId, String documentId) {
        return recordRepository.findByPatientKeyAndDocumentId(patientKey(patientId), documentId)
                .map(entity -> readRecord(entity.getRecordJson()));
    }

    @Override
    public List<String> listKeys(String patientId) {
        return recordRepository.findByPatientKeyOrderByStoredAtDesc(patientKey(patientId)).stream()
                .map(ClinicalRecordEntity::getDocumentId)
                .toList();
    }

    @Override
    public long deleteAllForPatient(String patientId) {
        try {
            return recordRepository.deleteByPatientKey(patientKey(patientId));
        } catch (DataAccessException e) {
            throw new StorageBackendException(type(), "Failed to delete clinical records", e);
        }
    }

    private Map<String, Object> readRecord(String json) {
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new StorageBackendException(type(), "Stored clinical record is not valid JSON", e);
        }
    }

    private String patientKey(String patientId) {
        return identityManager.rehashForStore(patientId, storeSalt);
    }
}
