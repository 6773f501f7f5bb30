package com.meditwin.ingestion.storage.profile;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meditwin.common.entity.PatientProfile;
import com.meditwin.common.identity.PatientIdentityManager;
import com.meditwin.common.repository.PatientProfileRepository;
import com.meditwin.ingestion.TestRecords;
import com.meditwin.ingestion.storage.BackendType;
import com.meditwin.ingestion.storage.StorageBackendException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PatientProfileStore: attribute merging across documents.
 */
@ExtendWith(MockitoExtension.class)
class PatientProfileStoreTest {

    private static final String PATIENT_ID = "PT_0123456789ABCDEF";

    @Mock
    private PatientProfileRepository profileRepository;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final PatientIdentityManager identityManager = new PatientIdentityManager("test-salt");
    private PatientProfileStore store;
    private String patientKey;

    @BeforeEach
    void setUp() {
        store = new PatientProfileStore(profileRepository, new LifestyleSignalExtractor(), objectMapper,
                identityManager, "profile-salt");
        patientKey = identityManager.rehashForStore(PATIENT_ID, "profile-salt");
    }

    @Test
    @DisplayName("Should overwrite scalars and union lists when merging")
    void merge_shouldOverwriteScalarsAndUnionLists() {
        Map<String, Object> merged = PatientProfileStore.merge(
                Map.of("smokingStatus", "current_smoker", "medicalHistory", List.of("Asthma", "Migraine")),
                Map.of("smokingStatus", "former_smoker", "medicalHistory", List.of("Migraine", "Knee sprain")));

        assertEquals("former_smoker", merged.get("smokingStatus"));
        assertEquals(List.of("Asthma", "Migraine", "Knee sprain"), merged.get("medicalHistory"));
    }

    @Test
    @DisplayName("Should merge new signals into an existing profile")
    void store_shouldMergeIntoExistingProfile() throws Exception {
        PatientProfile existing = new PatientProfile(patientKey);
        existing.applyMerge("{\"smokingStatus\":\"current_smoker\",\"medicalHistory\":[\"Asthma\"]}");
        when(profileRepository.findById(patientKey)).thenReturn(Optional.of(existing));

        long written = store.store(TestRecords.kneeVisit(PATIENT_ID, "doc-1"), List.of());

        assertEquals(3, written);
        verify(profileRepository).save(existing);
        Map<String, Object> attributes = objectMapper.readValue(existing.getAttributesJson(),
                new TypeReference<Map<String, Object>>() {
                });
        assertEquals("former_smoker", attributes.get("smokingStatus"));
        assertEquals("active", attributes.get("exerciseLevel"));
        assertEquals(List.of("Asthma", "Knee sprain"), attributes.get(PatientProfileStore.MEDICAL_HISTORY));
        assertEquals(2, existing.getDocumentCount());
    }

    @Test
    @DisplayName("Should create a profile for a first-time patient")
    void store_shouldCreateProfile() {
        when(profileRepository.findById(patientKey)).thenReturn(Optional.empty());

        store.store(TestRecords.kneeVisit(PATIENT_ID, "doc-1"), List.of());

        ArgumentCaptor<PatientProfile> saved = ArgumentCaptor.forClass(PatientProfile.class);
        verify(profileRepository).save(saved.capture());
        assertEquals(patientKey, saved.getValue().getPatientKey());
        assertEquals(1, saved.getValue().getDocumentCount());
    }

    @Test
    @DisplayName("Should redo the merge on the fresh profile when another worker saved first")
    void store_shouldRetryAfterVersionConflict() throws Exception {
        PatientProfile stale = new PatientProfile(patientKey);
        stale.applyMerge("{\"medicalHistory\":[\"Asthma\"]}");
        PatientProfile fresh = new PatientProfile(patientKey);
        fresh.applyMerge("{\"medicalHistory\":[\"Asthma\"]}");
        fresh.applyMerge("{\"medicalHistory\":[\"Asthma\",\"Migraine\"],\"alcoholStatus\":\"social_drinker\"}");
        when(profileRepository.findById(patientKey)).thenReturn(Optional.of(stale), Optional.of(fresh));
        when(profileRepository.save(any(PatientProfile.class)))
                .thenThrow(new ObjectOptimisticLockingFailureException(PatientProfile.class, patientKey))
                .thenAnswer(invocation -> invocation.getArgument(0));

        long written = store.store(TestRecords.kneeVisit(PATIENT_ID, "doc-2"), List.of());

        assertEquals(3, written);
        verify(profileRepository, times(2)).save(any(PatientProfile.class));
        Map<String, Object> attributes = objectMapper.readValue(fresh.getAttributesJson(),
                new TypeReference<Map<String, Object>>() {
                });
        assertEquals(List.of("Asthma", "Migraine", "Knee sprain"), attributes.get(PatientProfileStore.MEDICAL_HISTORY));
        assertEquals("social_drinker", attributes.get("alcoholStatus"));
        assertEquals(3, fresh.getDocumentCount());
    }

    @Test
    @DisplayName("Should merge into the profile a concurrent first document created")
    void store_shouldRetryWhenProfileWasCreatedConcurrently() {
        PatientProfile created = new PatientProfile(patientKey);
        created.applyMerge("{\"medicalHistory\":[\"Asthma\"]}");
        when(profileRepository.findById(patientKey)).thenReturn(Optional.empty(), Optional.of(created));
        when(profileRepository.save(any(PatientProfile.class)))
                .thenThrow(new DataIntegrityViolationException("duplicate key value violates unique constraint"))
                .thenAnswer(invocation -> invocation.getArgument(0));

        store.store(TestRecords.kneeVisit(PATIENT_ID, "doc-2"), List.of());

        assertEquals(2, created.getDocumentCount());
        assertTrue(created.getAttributesJson().contains("Knee sprain"));
    }

    @Test
    @DisplayName("Should fail the profile write when conflicts never settle")
    void store_shouldGiveUpAfterRepeatedConflicts() {
        when(profileRepository.findById(patientKey)).thenReturn(Optional.of(new PatientProfile(patientKey)));
        when(profileRepository.save(any(PatientProfile.class)))
                .thenThrow(new ObjectOptimisticLockingFailureException(PatientProfile.class, patientKey));

        StorageBackendException error = assertThrows(StorageBackendException.class,
                () -> store.store(TestRecords.kneeVisit(PATIENT_ID, "doc-2"), List.of()));

        assertEquals(BackendType.PROFILE, error.getBackend());
        verify(profileRepository, times(PatientProfileStore.MAX_SAVE_ATTEMPTS)).save(any(PatientProfile.class));
    }

    @Test
    @DisplayName("Should read one attribute and report nothing for unknown ones")
    void get_shouldReturnSingleAttribute() {
        PatientProfile profile = new PatientProfile(patientKey);
        profile.applyMerge("{\"smokingStatus\":\"former_smoker\",\"exerciseLevel\":\"active\"}");
        when(profileRepository.findById(patientKey)).thenReturn(Optional.of(profile));

        assertEquals(Optional.of(Map.of("smokingStatus", "former_smoker")), store.get(PATIENT_ID, "smokingStatus"));
        assertTrue(store.get(PATIENT_ID, "alcoholStatus").isEmpty());
        assertEquals(List.of("smokingStatus", "exerciseLevel"), store.listKeys(PATIENT_ID));
    }

    @Test
    @DisplayName("Should delete an existing profile and report zero otherwise")
    void deleteAllForPatient_shouldReportRemovedProfiles() {
        when(profileRepository.existsById(patientKey)).thenReturn(true, false);

        assertEquals(1, store.deleteAllForPatient(PATIENT_ID));
        assertEquals(0, store.deleteAllForPatient(PATIENT_ID));
        verify(profileRepository, times(1)).deleteById(patientKey);
    }
}
