package com.meditwin.ingestion.storage.graph;

import com.meditwin.common.identity.PatientIdentityManager;
import com.meditwin.ingestion.clinical.AnatomyVocabulary;
import com.meditwin.ingestion.model.ClinicalRecord;
import com.meditwin.ingestion.model.Diagnosis;
import com.meditwin.ingestion.model.EmbeddingRecord;
import com.meditwin.ingestion.model.InjuryEvent;
import com.meditwin.ingestion.model.Procedure;
import com.meditwin.ingestion.model.SeverityLevel;
import com.meditwin.ingestion.storage.BackendType;
import com.meditwin.ingestion.storage.StorageBackend;
import com.meditwin.ingestion.storage.StorageBackendException;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.TransactionConfig;
import org.neo4j.driver.TransactionContext;
import org.neo4j.driver.Value;
import org.neo4j.driver.exceptions.Neo4jException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Anatomical graph of a patient: (Patient)-[:HAS_REGION {severity}]->(AnatomicalRegion) plus one
 * MedicalEvent per injury, diagnosis and procedure, linked to the patient and to the affected region.
 * Region severity on the HAS_REGION edge is recalculated after every write.
 */
@Slf4j
@Component
public class Neo4jGraphStore implements StorageBackend {

    static final int SEVERITY_WINDOW_DAYS = 90;

    private static final String ENSURE_PATIENT = """
            MERGE (p:Patient {patient_key: $patientKey})
            ON CREATE SET p.created_at = datetime()
            WITH p
            UNWIND $regions AS regionName
            MERGE (r:AnatomicalRegion {name: regionName})
            MERGE (p)-[h:HAS_REGION]->(r)
            ON CREATE SET h.severity = 'NA', h.event_count = 0
            """;

    // %s is the relationship type, taken from GraphEvent.Kind only
    private static final String CREATE_EVENT = """
            MATCH (p:Patient {patient_key: $patientKey})
            MERGE (r:AnatomicalRegion {name: $region})
            MERGE (p)-[h:HAS_REGION]->(r)
            ON CREATE SET h.severity = 'NA', h.event_count = 0
            MERGE (e:MedicalEvent {event_id: $eventId})
            ON CREATE SET e.created_at = datetime()
            SET e.event_type = $eventType, e.description = $description, e.severity = $severity,
                e.confidence = $confidence, e.event_date = $eventDate, e.document_id = $documentId
            MERGE (p)-[:HAS_EVENT]->(e)
            MERGE (e)-[:%s]->(r)
            """;

    private static final String RECENT_REGION_EVENTS = """
            MATCH (p:Patient {patient_key: $patientKey})-[:HAS_REGION]->(r:AnatomicalRegion)
            OPTIONAL MATCH (p)-[:HAS_EVENT]->(e:MedicalEvent)-->(r)
            WHERE e.created_at >= datetime() - duration({days: $windowDays})
            RETURN r.name AS region,
                   collect(CASE WHEN e IS NULL THEN NULL
                           ELSE {severity: e.severity, confidence: e.confidence} END) AS events
            """;

    private static final String UPDATE_REGION_SEVERITY = """
            UNWIND $updates AS u
            MATCH (p:Patient {patient_key: $patientKey})-[h:HAS_REGION]->(r:AnatomicalRegion {name: u.region})
            SET h.severity = u.severity, h.event_count = u.eventCount, h.updated_at = datetime()
            """;

    private final Driver driver;
    private final PatientIdentityManager identityManager;
    private final AnatomyVocabulary vocabulary;
    private final SeverityCalculator severityCalculator;
    private final String storeSalt;
    private final TransactionConfig transactionConfig;

    public Neo4jGraphStore(Driver driver,
            PatientIdentityManager identityManager,
            AnatomyVocabulary vocabulary,
            SeverityCalculator severityCalculator,
            @org.springframework.beans.factory.annotation.Value("${meditwin.identity.store-salts.graph:}") String storeSalt,
            @org.springframework.beans.factory.annotation.Value("${meditwin.timeouts.backend-seconds:30}") long backendTimeoutSeconds) {
        this.driver = driver;
        this.identityManager = identityManager;
        this.vocabulary = vocabulary;
        this.severityCalculator = severityCalculator;
        this.storeSalt = storeSalt;
        this.transactionConfig = TransactionConfig.builder().withTimeout(Duration.ofSeconds(backendTimeoutSeconds)).build();
    }

    @Override
    public BackendType type() {
        return BackendType.GRAPH;
    }

    @Override
    public long store(ClinicalRecord record, List<EmbeddingRecord> embeddings) {
        String patientKey = patientKey(record.patientId());
        List<GraphEvent> events = toEvents(record);

        try (Session session = driver.session()) {
            session.executeWriteWithoutResult(tx -> {
                tx.run(ENSURE_PATIENT, Map.of("patientKey", patientKey, "regions", vocabulary.regions()));
                for (GraphEvent event : events) {
                    createEvent(tx, patientKey, record.documentId(), event);
                }
            }, transactionConfig);

            session.executeWriteWithoutResult(tx -> recalculateSeverities(tx, patientKey), transactionConfig);
            return events.size();

        } catch (Neo4jException e) {
            throw new StorageBackendException(type(), "Graph write failed: " + e.getMessage(), e);
        }
    }

    /** Event properties by event id */
    @Override
    public Optional<Map<String, Object>> get(String patientId, String eventId) {
        String patientKey = patientKey(patientId);
        try (Session session = driver.session()) {
            return session.executeRead(tx -> {
                List<Record> records = tx.run("""
                        MATCH (:Patient {patient_key: $patientKey})-[:HAS_EVENT]->(e:MedicalEvent {event_id: $eventId})
                        RETURN e
                        """, Map.of("patientKey", patientKey, "eventId", eventId)).list();
                return records.stream().findFirst().map(found -> found.get("e").asMap());
            }, transactionConfig);
        } catch (Neo4jException e) {
            throw new StorageBackendException(type(), "Graph read failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<String> listKeys(String patientId) {
        String patientKey = patientKey(patientId);
        try (Session session = driver.session()) {
            return session.executeRead(tx -> tx.run("""
                    MATCH (:Patient {patient_key: $patientKey})-[:HAS_EVENT]->(e:MedicalEvent)
                    RETURN e.event_id AS eventId ORDER BY e.created_at
                    """, Map.of("patientKey", patientKey))
                    .list(found -> found.get("eventId").asString()), transactionConfig);
        } catch (Neo4jException e) {
            throw new StorageBackendException(type(), "Graph read failed: " + e.getMessage(), e);
        }
    }

    @Override
    public long deleteAllForPatient(String patientId) {
        String patientKey = patientKey(patientId);
        try (Session session = driver.session()) {
            return session.executeWrite(tx -> {
                List<Record> records = tx.run("""
                        MATCH (p:Patient {patient_key: $patientKey})
                        OPTIONAL MATCH (p)-[:HAS_EVENT]->(e:MedicalEvent)
                        WITH p, collect(e) AS events
                        FOREACH (event IN events | DETACH DELETE event)
                        DETACH DELETE p
                        RETURN size(events) AS removed
                        """, Map.of("patientKey", patientKey)).list();
                return records.isEmpty() ? 0L : records.get(0).get("removed").asLong();
            }, transactionConfig);
        } catch (Neo4jException e) {
            throw new StorageBackendException(type(), "Graph delete failed: " + e.getMessage(), e);
        }
    }

    /**
     * Injuries keep their extracted severity and body part. Diagnoses are moderate and procedures mild;
     * their region is the first vocabulary region named in the text, else "General".
     */
    List<GraphEvent> toEvents(ClinicalRecord record) {
        List<GraphEvent> events = new ArrayList<>();
        int index = 0;
        for (InjuryEvent injury : record.injuries()) {
            events.add(new GraphEvent(eventId(record, GraphEvent.Kind.INJURY, index++), GraphEvent.Kind.INJURY,
                    injury.description(), injury.bodyPart(), injury.severity(), injury.date()));
        }
        for (Diagnosis diagnosis : record.diagnoses()) {
            events.add(new GraphEvent(eventId(record, GraphEvent.Kind.DIAGNOSIS, index++), GraphEvent.Kind.DIAGNOSIS,
                    diagnosis.name(), vocabulary.regionOrGeneral(diagnosis.source().context()),
                    SeverityLevel.MODERATE, diagnosis.dateDiagnosed()));
        }
        for (Procedure procedure : record.procedures()) {
            events.add(new GraphEvent(eventId(record, GraphEvent.Kind.PROCEDURE, index++), GraphEvent.Kind.PROCEDURE,
                    procedure.name(), vocabulary.regionOrGeneral(procedure.name()),
                    SeverityLevel.MILD, procedure.date()));
        }
        return events;
    }

    private void createEvent(TransactionContext tx, String patientKey, String documentId, GraphEvent event) {
        Map<String, Object> parameters = new HashMap<>();
        parameters.put("patientKey", patientKey);
        parameters.put("region", event.region());
        parameters.put("eventId", event.eventId());
        parameters.put("eventType", event.kind().name().toLowerCase());
        parameters.put("description", event.description());
        parameters.put("severity", event.severity().label());
        parameters.put("confidence", event.kind().confidence());
        parameters.put("eventDate", event.eventDate());
        parameters.put("documentId", documentId);
        tx.run(String.format(CREATE_EVENT, event.kind().relationship()), parameters);
    }

    private void recalculateSeverities(TransactionContext tx, String patientKey) {
        List<Record> regions = tx.run(RECENT_REGION_EVENTS,
                Map.of("patientKey", patientKey, "windowDays", SEVERITY_WINDOW_DAYS)).list();

        List<Map<String, Object>> updates = new ArrayList<>(regions.size());
        for (Record region : regions) {
            List<SeverityCalculator.EventSeverity> severities = region.get("events").asList(this::toEventSeverity);
            SeverityLevel severity = severityCalculator.calculate(severities);
            updates.add(Map.of(
                    "region", region.get("region").asString(),
                    "severity", severity.label(),
                    "eventCount", severities.size()));
        }
        tx.run(UPDATE_REGION_SEVERITY, Map.of("patientKey", patientKey, "updates", updates));
    }

    private SeverityCalculator.EventSeverity toEventSeverity(Value event) {
        return new SeverityCalculator.EventSeverity(
                SeverityLevel.fromLabel(event.get("severity", "NA")),
                event.get("confidence", 1.0));
    }

    private static String eventId(ClinicalRecord record, GraphEvent.Kind kind, int index) {
        return record.documentId() + "_" + kind.name().toLowerCase() + "_" + index;
    }

    private String patientKey(String patientId) {
        return identityManager.rehashForStore(patientId, storeSalt);
    }
}
