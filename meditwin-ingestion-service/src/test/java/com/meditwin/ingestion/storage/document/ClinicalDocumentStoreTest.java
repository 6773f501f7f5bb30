package com.meditwin.ingestion.storage.document;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meditwin.common.entity.ClinicalRecordEntity;
import com.meditwin.common.identity.PatientIdentityManager;
import com.meditwin.common.repository.ClinicalRecordRepository;
import com.meditwin.ingestion.TestRecords;
import com.meditwin.ingestion.model.ClinicalRecord;
import com.meditwin.ingestion.storage.StorageBackendException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ClinicalDocumentStoreTest {

    private static final String PATIENT_ID = "PT_0123456789ABCDEF";

    @Mock
    private ClinicalRecordRepository recordRepository;

    private final PatientIdentityManager identityManager = new PatientIdentityManager("test-salt");
    private ClinicalDocumentStore store;
    private String patientKey;

    @BeforeEach
    void setUp() {
        store = new ClinicalDocumentStore(recordRepository, new ObjectMapper(), identityManager, "document-salt");
        patientKey = identityManager.rehashForStore(PATIENT_ID, "document-salt");
    }

    @Test
    @DisplayName("Should save the record under the store-specific patient key")
    void store_shouldSaveRecordUnderRehashedKey() {
        when(recordRepository.findByPatientKeyAndDocumentId(patientKey, "doc-1")).thenReturn(Optional.empty());

        long written = store.store(TestRecords.kneeVisit(PATIENT_ID, "doc-1"), List.of());

        assertEquals(1, written);
        ArgumentCaptor<ClinicalRecordEntity> saved = ArgumentCaptor.forClass(ClinicalRecordEntity.class);
        verify(recordRepository).save(saved.capture());
        assertEquals(patientKey, saved.getValue().getPatientKey());
        assertNotEquals(PATIENT_ID, saved.getValue().getPatientKey());
        assertEquals("SOAP Note", saved.getValue().getDocumentTitle());
        assertTrue(saved.getValue().getRecordJson().contains("\"Knee sprain\""));
        assertFalse(saved.getValue().getRecordJson().contains(PATIENT_ID));
    }

    @Test
    @DisplayName("Should replace the content of an existing row for the same document")
    void store_shouldReplaceExistingRow() {
        ClinicalRecordEntity existing = new ClinicalRecordEntity(patientKey, "doc-1", "Old", "01/01/2020", "{}");
        when(recordRepository.findByPatientKeyAndDocumentId(patientKey, "doc-1")).thenReturn(Optional.of(existing));

        store.store(TestRecords.kneeVisit(PATIENT_ID, "doc-1"), List.of());

        verify(recordRepository).save(existing);
        assertEquals("SOAP Note", existing.getDocumentTitle());
        assertNotEquals("{}", existing.getRecordJson());
    }

    @Test
    @DisplayName("Should wrap database errors in a storage backend exception")
    void store_shouldWrapDataAccessErrors() {
        when(recordRepository.findByPatientKeyAndDocumentId(anyString(), anyString())).thenReturn(Optional.empty());
        when(recordRepository.save(any())).thenThrow(new DataAccessResourceFailureException("connection refused"));

        ClinicalRecord record = TestRecords.kneeVisit(PATIENT_ID, "doc-1");
        assertThrows(StorageBackendException.class, () -> store.store(record, List.of()));
    }

    @Test
    @DisplayName("Should read a stored record back as a map")
    void get_shouldReturnStoredJson() {
        ClinicalRecordEntity entity = new ClinicalRecordEntity(patientKey, "doc-1", "SOAP Note", "03/15/2024",
                "{\"documentId\":\"doc-1\",\"documentTitle\":\"SOAP Note\"}");
        when(recordRepository.findByPatientKeyAndDocumentId(patientKey, "doc-1")).thenReturn(Optional.of(entity));

        Optional<Map<String, Object>> stored = store.get(PATIENT_ID, "doc-1");

        assertTrue(stored.isPresent());
        assertEquals("SOAP Note", stored.get().get("documentTitle"));
    }

    @Test
    @DisplayName("Should list and delete by the rehashed key")
    void listAndDelete_shouldUseRehashedKey() {
        when(recordRepository.findByPatientKeyOrderByStoredAtDesc(patientKey)).thenReturn(List.of(
                new ClinicalRecordEntity(patientKey, "doc-2", "B", "NA", "{}"),
                new ClinicalRecordEntity(patientKey, "doc-1", "A", "NA", "{}")));
        when(recordRepository.deleteByPatientKey(patientKey)).thenReturn(2L);

        assertEquals(List.of("doc-2", "doc-1"), store.listKeys(PATIENT_ID));
        assertEquals(2L, store.deleteAllForPatient(PATIENT_ID));
    }
}
