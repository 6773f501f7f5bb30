package com.meditwin.ingestion.storage.graph;

import com.meditwin.common.identity.PatientIdentityManager;
import com.meditwin.ingestion.TestRecords;
import com.meditwin.ingestion.clinical.AnatomyVocabulary;
import com.meditwin.ingestion.model.ClinicalRecord;
import com.meditwin.ingestion.model.SeverityLevel;
import com.meditwin.ingestion.storage.StorageBackendException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Session;
import org.neo4j.driver.TransactionConfig;
import org.neo4j.driver.exceptions.ServiceUnavailableException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for Neo4jGraphStore: mapping clinical facts to graph events and error translation.
 */
@ExtendWith(MockitoExtension.class)
class Neo4jGraphStoreTest {

    @Mock
    private Driver driver;

    @Mock
    private Session session;

    private Neo4jGraphStore store;

    @BeforeEach
    void setUp() {
        store = new Neo4jGraphStore(driver, new PatientIdentityManager("test-salt"), AnatomyVocabulary.defaults(),
                new SeverityCalculator(), "graph-salt", 5);
    }

    @Test
    @DisplayName("Should map injuries, diagnoses and procedures to events on their regions")
    void toEvents_shouldMapFactsToRegions() {
        List<GraphEvent> events = store.toEvents(TestRecords.kneeVisit("PT_0123456789ABCDEF", "doc-1"));

        assertEquals(3, events.size());

        GraphEvent injury = events.get(0);
        assertEquals(GraphEvent.Kind.INJURY, injury.kind());
        assertEquals("Left Knee", injury.region());
        assertEquals(SeverityLevel.MODERATE, injury.severity());
        assertEquals("doc-1_injury_0", injury.eventId());

        GraphEvent diagnosis = events.get(1);
        assertEquals(GraphEvent.Kind.DIAGNOSIS, diagnosis.kind());
        assertEquals("Left Knee", diagnosis.region());
        assertEquals(SeverityLevel.MODERATE, diagnosis.severity());
        assertEquals("doc-1_diagnosis_1", diagnosis.eventId());

        GraphEvent procedure = events.get(2);
        assertEquals(GraphEvent.Kind.PROCEDURE, procedure.kind());
        assertEquals(AnatomyVocabulary.GENERAL_REGION, procedure.region());
        assertEquals(SeverityLevel.MILD, procedure.severity());
        assertEquals("PERFORMED_ON", procedure.kind().relationship());
    }

    @Test
    @DisplayName("Should produce no events for a record without facts")
    void toEvents_shouldHandleEmptyRecord() {
        ClinicalRecord record = TestRecords.empty("PT_0123456789ABCDEF", "doc-2");

        assertTrue(store.toEvents(record).isEmpty());
    }

    @Test
    @DisplayName("Should translate driver errors into storage backend exceptions")
    void store_shouldWrapDriverErrors() {
        when(driver.session()).thenReturn(session);
        doThrow(new ServiceUnavailableException("connection refused"))
                .when(session).executeWriteWithoutResult(any(), any(TransactionConfig.class));

        ClinicalRecord record = TestRecords.kneeVisit("PT_0123456789ABCDEF", "doc-1");
        StorageBackendException error = assertThrows(StorageBackendException.class,
                () -> store.store(record, List.of()));

        assertTrue(error.getMessage().contains("connection refused"));
        verify(session).close();
    }
}
