package com.meditwin.ingestion.storage;

import com.meditwin.ingestion.model.ClinicalRecord;
import com.meditwin.ingestion.model.EmbeddingRecord;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One persistence system holding a view of patient data. Implementations key their data by their own
 * rehash of the patient id and signal failures with {@link StorageBackendException}.
 */
public interface StorageBackend {

    BackendType type();

    /**
     * Write this backend's view of the record.
     *
     * @return number of items written
     */
    long store(ClinicalRecord record, List<EmbeddingRecord> embeddings);

    /**
     * Look up one item by its backend key (document id, event id, chunk id or profile attribute).
     */
    Optional<Map<String, Object>> get(String patientId, String key);

    List<String> listKeys(String patientId);

    /**
     * @return number of items removed
     */
    long deleteAllForPatient(String patientId);
}
