package com.meditwin.ingestion.service;

import com.meditwin.common.identity.PatientIdentityManager;
import com.meditwin.common.repository.ProcessingJobRepository;
import com.meditwin.ingestion.audit.AuditLogger;
import com.meditwin.ingestion.storage.BackendOutcome;
import com.meditwin.ingestion.storage.BackendType;
import com.meditwin.ingestion.storage.StorageBackend;
import com.meditwin.ingestion.storage.StorageBackendException;
import com.meditwin.ingestion.storage.StorageCoordinator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PatientDataService: listing and erasing a patient's data across backends.
 */
@ExtendWith(MockitoExtension.class)
class PatientDataServiceTest {

    private static final String CALLER_ID = "caller-123";

    @Mock
    private StorageCoordinator storageCoordinator;

    @Mock
    private ProcessingJobRepository jobRepository;

    @Mock
    private StorageBackend documentStore;

    @Mock
    private StorageBackend graphStore;

    private final PatientIdentityManager identityManager = new PatientIdentityManager("test-salt");
    private PatientDataService service;
    private String patientId;

    @BeforeEach
    void setUp() {
        service = new PatientDataService(storageCoordinator, jobRepository, identityManager,
                new AuditLogger(identityManager));
        patientId = identityManager.deriveId(CALLER_ID);
        when(storageCoordinator.getBackends()).thenReturn(List.of(documentStore, graphStore));
        when(documentStore.type()).thenReturn(BackendType.DOCUMENT);
    }

    @Test
    @DisplayName("Should list document ids from the document store")
    void listRecords_shouldReadDocumentStore() {
        when(documentStore.listKeys(patientId)).thenReturn(List.of("doc-2", "doc-1"));

        assertEquals(List.of("doc-2", "doc-1"), service.listRecords(CALLER_ID));
        verify(graphStore, never()).listKeys(anyString());
    }

    @Test
    @DisplayName("Should erase every backend and report a failing one without stopping")
    void deleteAll_shouldContinuePastFailures() {
        when(graphStore.type()).thenReturn(BackendType.GRAPH);
        when(documentStore.deleteAllForPatient(patientId)).thenReturn(4L);
        when(graphStore.deleteAllForPatient(patientId))
                .thenThrow(new StorageBackendException(BackendType.GRAPH, "graph unreachable"));
        when(jobRepository.deleteByPatientId(patientId)).thenReturn(5L);

        Map<String, Object> report = service.deleteAll(CALLER_ID);

        assertEquals(BackendOutcome.succeeded(BackendType.DOCUMENT, 4), report.get("document_store"));
        assertEquals(BackendOutcome.failed(BackendType.GRAPH, "Deletion failed"), report.get("graph_store"));
        assertEquals(5L, report.get("jobs"));
        verify(jobRepository).deleteByPatientId(patientId);
    }
}
