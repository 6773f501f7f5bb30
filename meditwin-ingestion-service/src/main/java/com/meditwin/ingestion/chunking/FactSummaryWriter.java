package com.meditwin.ingestion.chunking;

import com.meditwin.ingestion.model.ClinicalRecord;
import com.meditwin.ingestion.model.Diagnosis;
import com.meditwin.ingestion.model.InjuryEvent;
import com.meditwin.ingestion.model.Medication;
import com.meditwin.ingestion.model.Procedure;
import com.meditwin.ingestion.model.TimelineEvent;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Renders each non-empty fact category of a record as plain sentences for retrieval.
 */
final class FactSummaryWriter {

    private FactSummaryWriter() {
    }

    /** Summary section name to summary text, only for categories with entries */
    static Map<String, String> summarize(ClinicalRecord record) {
        Map<String, String> summaries = new LinkedHashMap<>();
        put(summaries, "injuries_summary", record.injuries(), FactSummaryWriter::describe);
        put(summaries, "diagnoses_summary", record.diagnoses(), FactSummaryWriter::describe);
        put(summaries, "procedures_summary", record.procedures(), FactSummaryWriter::describe);
        put(summaries, "medications_summary", record.medications(), FactSummaryWriter::describe);
        put(summaries, "timeline_summary", record.timeline(), FactSummaryWriter::describe);
        return summaries;
    }

    private static <T> void put(Map<String, String> summaries, String section, List<T> entries,
            Function<T, String> describer) {
        if (entries.isEmpty()) {
            return;
        }
        summaries.put(section, entries.stream().map(describer).collect(Collectors.joining(". ")) + ".");
    }

    static String describe(InjuryEvent injury) {
        StringBuilder sentence = new StringBuilder("Injury: ")
                .append(injury.description())
                .append(" affecting ").append(injury.bodyPart())
                .append(" with ").append(injury.severity().label()).append(" severity");
        if (ClinicalRecord.isAvailable(injury.date())) {
            sentence.append(" on ").append(injury.date());
        }
        return sentence.toString();
    }

    static String describe(Diagnosis diagnosis) {
        StringBuilder sentence = new StringBuilder("Diagnosis: ").append(diagnosis.name());
        if (ClinicalRecord.isAvailable(diagnosis.code())) {
            sentence.append(" (code ").append(diagnosis.code()).append(')');
        }
        return sentence.append(", status ").append(diagnosis.status()).toString();
    }

    static String describe(Procedure procedure) {
        StringBuilder sentence = new StringBuilder("Procedure: ").append(procedure.name());
        if (ClinicalRecord.isAvailable(procedure.date())) {
            sentence.append(" on ").append(procedure.date());
        }
        return sentence.toString();
    }

    static String describe(Medication medication) {
        StringBuilder sentence = new StringBuilder("Medication: ").append(medication.name());
        if (ClinicalRecord.isAvailable(medication.dosage())) {
            sentence.append(", dosage ").append(medication.dosage());
        }
        if (ClinicalRecord.isAvailable(medication.frequency())) {
            sentence.append(", frequency ").append(medication.frequency());
        }
        return sentence.toString();
    }

    static String describe(TimelineEvent event) {
        return event.date() + ": " + event.event();
    }
}
