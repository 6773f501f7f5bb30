package com.meditwin.ingestion.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured facts extracted from one document. Every field is always present: absent scalar facts
 * hold {@link #NOT_AVAILABLE} and absent categories are empty lists.
 */
public record ClinicalRecord(
        String patientId,
        String documentId,
        String documentTitle,
        String documentDate,
        Clinician clinician,
        List<InjuryEvent> injuries,
        List<Diagnosis> diagnoses,
        List<Procedure> procedures,
        List<Medication> medications,
        List<TimelineEvent> timeline,
        List<MedicalCode> medicalCodes,
        Map<String, String> sectionTexts,
        Map<String, String> narrativeTexts,
        Map<String, Object> metadata
) {
    public static final String NOT_AVAILABLE = "Not Available";

    public static final String SUBJECTIVE = "subjective";
    public static final String OBJECTIVE = "objective";
    public static final String ASSESSMENT = "assessment";
    public static final String PLAN = "plan";
    public static final List<String> SOAP_SECTIONS = List.of(SUBJECTIVE, OBJECTIVE, ASSESSMENT, PLAN);

    public static final String FEEDBACK = "feedback";
    public static final String RECOVERY_PROGRESS = "recovery_progress";
    public static final String HISTORY = "history";
    public static final List<String> NARRATIVES = List.of(FEEDBACK, RECOVERY_PROGRESS, HISTORY);

    public ClinicalRecord {
        documentTitle = orNotAvailable(documentTitle);
        documentDate = orNotAvailable(documentDate);
        clinician = clinician == null ? Clinician.unknown() : clinician;
        injuries = List.copyOf(injuries);
        diagnoses = List.copyOf(diagnoses);
        procedures = List.copyOf(procedures);
        medications = List.copyOf(medications);
        timeline = List.copyOf(timeline);
        medicalCodes = List.copyOf(medicalCodes);
        sectionTexts = complete(sectionTexts, SOAP_SECTIONS);
        narrativeTexts = complete(narrativeTexts, NARRATIVES);
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /** Copy keyed to another patient identifier, used when a backend stores its own hashed key */
    public ClinicalRecord withPatientId(String otherPatientId) {
        return new ClinicalRecord(otherPatientId, documentId, documentTitle, documentDate, clinician,
                injuries, diagnoses, procedures, medications, timeline, medicalCodes,
                sectionTexts, narrativeTexts, metadata);
    }

    public static boolean isAvailable(String value) {
        return value != null && !value.isBlank() && !NOT_AVAILABLE.equals(value);
    }

    private static String orNotAvailable(String value) {
        return isAvailable(value) ? value : NOT_AVAILABLE;
    }

    private static Map<String, String> complete(Map<String, String> source, List<String> keys) {
        Map<String, String> result = new LinkedHashMap<>();
        for (String key : keys) {
            result.put(key, orNotAvailable(source == null ? null : source.get(key)));
        }
        return Collections.unmodifiableMap(result);
    }
}
