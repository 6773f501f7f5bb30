package com.meditwin.ingestion.storage.profile;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meditwin.common.entity.PatientProfile;
import com.meditwin.common.identity.PatientIdentityManager;
import com.meditwin.common.repository.PatientProfileRepository;
import com.meditwin.ingestion.model.ClinicalRecord;
import com.meditwin.ingestion.model.Diagnosis;
import com.meditwin.ingestion.model.EmbeddingRecord;
import com.meditwin.ingestion.storage.BackendType;
import com.meditwin.ingestion.storage.StorageBackend;
import com.meditwin.ingestion.storage.StorageBackendException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Long-term patient profile. Lifestyle signals and diagnosed conditions accumulate across documents.
 */
@Slf4j
@Component
public class PatientProfileStore implements StorageBackend {

    public static final String MEDICAL_HISTORY = "medicalHistory";

    static final int MAX_SAVE_ATTEMPTS = 3;

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final PatientProfileRepository profileRepository;
    private final LifestyleSignalExtractor signalExtractor;
    private final ObjectMapper objectMapper;
    private final PatientIdentityManager identityManager;
    private final String storeSalt;

    public PatientProfileStore(PatientProfileRepository profileRepository,
            LifestyleSignalExtractor signalExtractor,
            ObjectMapper objectMapper,
            PatientIdentityManager identityManager,
            @Value("${meditwin.identity.store-salts.profile:}") String storeSalt) {
        this.profileRepository = profileRepository;
        this.signalExtractor = signalExtractor;
        this.objectMapper = objectMapper;
        this.identityManager = identityManager;
        this.storeSalt = storeSalt;
    }

    @Override
    public BackendType type() {
        return BackendType.PROFILE;
    }

    /**
     * Read, merge and save. Each save runs in its own transaction; when another worker updated (or
     * created) the same profile in between, the merge is redone on the fresh row.
     */
    @Override
    public long store(ClinicalRecord record, List<EmbeddingRecord> embeddings) {
        Map<String, Object> updates = new LinkedHashMap<>(signalExtractor.extract(record));
        List<String> diagnosisNames = record.diagnoses().stream()
                .map(Diagnosis::name)
                .filter(ClinicalRecord::isAvailable)
                .toList();
        if (!diagnosisNames.isEmpty()) {
            updates.put(MEDICAL_HISTORY, diagnosisNames);
        }

        String patientKey = patientKey(record.patientId());
        for (int attempt = 1; ; attempt++) {
            try {
                mergeAndSave(patientKey, updates);
                log.debug("Profile updated with {} attributes", updates.size());
                return updates.size();

            } catch (OptimisticLockingFailureException | DataIntegrityViolationException e) {
                if (attempt >= MAX_SAVE_ATTEMPTS) {
                    throw new StorageBackendException(type(),
                            "Patient profile kept changing, gave up after " + attempt + " attempts", e);
                }
                log.debug("Concurrent profile update, retrying merge ({}/{})", attempt, MAX_SAVE_ATTEMPTS);
            } catch (JsonProcessingException e) {
                throw new StorageBackendException(type(), "Failed to serialize patient profile", e);
            } catch (DataAccessException e) {
                throw new StorageBackendException(type(), "Failed to save patient profile", e);
            }
        }
    }

    private void mergeAndSave(String patientKey, Map<String, Object> updates) throws JsonProcessingException {
        PatientProfile profile = profileRepository.findById(patientKey)
                .orElseGet(() -> new PatientProfile(patientKey));
        Map<String, Object> merged = merge(readAttributes(profile.getAttributesJson()), updates);
        profile.applyMerge(objectMapper.writeValueAsString(merged));
        profileRepository.save(profile);
    }

    /** One profile attribute by name */
    @Override
    public Optional<Map<String, Object>> get(String patientId, String attribute) {
        return profileRepository.findById(patientKey(patientId))
                .map(profile -> readAttributes(profile.getAttributesJson()))
                .filter(attributes -> attributes.containsKey(attribute))
                .map(attributes -> {
                    Map<String, Object> single = new LinkedHashMap<>();
                    single.put(attribute, attributes.get(attribute));
                    return single;
                });
    }

    @Override
    public List<String> listKeys(String patientId) {
        return profileRepository.findById(patientKey(patientId))
                .map(profile -> List.copyOf(readAttributes(profile.getAttributesJson()).keySet()))
                .orElse(List.of());
    }

    @Override
    @Transactional
    public long deleteAllForPatient(String patientId) {
        String patientKey = patientKey(patientId);
        try {
            if (!profileRepository.existsById(patientKey)) {
                return 0;
            }
            profileRepository.deleteById(patientKey);
            return 1;
        } catch (DataAccessException e) {
            throw new StorageBackendException(type(), "Failed to delete patient profile", e);
        }
    }

    /**
     * Scalars overwrite; lists become an ordered union of old and new values.
     */
    static Map<String, Object> merge(Map<String, Object> existing, Map<String, Object> updates) {
        Map<String, Object> merged = new LinkedHashMap<>(existing);
        updates.forEach((key, value) -> {
            Object current = merged.get(key);
            if (value instanceof Collection<?> incoming && current instanceof Collection<?> previous) {
                Set<Object> union = new LinkedHashSet<>(previous);
                union.addAll(incoming);
                merged.put(key, new ArrayList<>(union));
            } else {
                merged.put(key, value);
            }
        });
        return merged;
    }

    private Map<String, Object> readAttributes(String json) {
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new StorageBackendException(type(), "Stored patient profile is not valid JSON", e);
        }
    }

    private String patientKey(String patientId) {
        return identityManager.rehashForStore(patientId, storeSalt);
    }
}
