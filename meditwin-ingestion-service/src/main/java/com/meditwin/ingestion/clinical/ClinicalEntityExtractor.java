package com.meditwin.ingestion.clinical;

import com.meditwin.ingestion.model.ClinicalRecord;
import com.meditwin.ingestion.model.Diagnosis;
import com.meditwin.ingestion.model.ExtractedText;
import com.meditwin.ingestion.model.InjuryEvent;
import com.meditwin.ingestion.model.MedicalCode;
import com.meditwin.ingestion.model.Medication;
import com.meditwin.ingestion.model.Procedure;
import com.meditwin.ingestion.model.StageResult;
import com.meditwin.ingestion.model.TimelineEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the {@link ClinicalRecord} for a document by running every fact rule over the full text.
 * Rules are injected individually so any one of them can be replaced.
 */
@Slf4j
@Component
public class ClinicalEntityExtractor {

    private final ClinicalFactRule<InjuryEvent> injuryRule;
    private final ClinicalFactRule<Diagnosis> diagnosisRule;
    private final ClinicalFactRule<Procedure> procedureRule;
    private final ClinicalFactRule<Medication> medicationRule;
    private final ClinicalFactRule<TimelineEvent> timelineRule;
    private final ClinicalFactRule<MedicalCode> medicalCodeRule;
    private final DocumentHeaderExtractor headerExtractor;
    private final NarrativeExtractor narrativeExtractor;

    public ClinicalEntityExtractor(ClinicalFactRule<InjuryEvent> injuryRule,
            ClinicalFactRule<Diagnosis> diagnosisRule,
            ClinicalFactRule<Procedure> procedureRule,
            ClinicalFactRule<Medication> medicationRule,
            ClinicalFactRule<TimelineEvent> timelineRule,
            ClinicalFactRule<MedicalCode> medicalCodeRule,
            DocumentHeaderExtractor headerExtractor,
            NarrativeExtractor narrativeExtractor) {
        this.injuryRule = injuryRule;
        this.diagnosisRule = diagnosisRule;
        this.procedureRule = procedureRule;
        this.medicationRule = medicationRule;
        this.timelineRule = timelineRule;
        this.medicalCodeRule = medicalCodeRule;
        this.headerExtractor = headerExtractor;
        this.narrativeExtractor = narrativeExtractor;
    }

    /**
     * Never fails: a document without matches yields a record of sentinels and empty lists.
     */
    public StageResult<ClinicalRecord> extract(ExtractedText extracted, String patientId, String documentId,
            Map<String, String> documentMetadata) {
        String text = extracted.fullText();
        Map<String, String> sections = extracted.sections();

        List<InjuryEvent> injuries = injuryRule.extract(text);
        List<Diagnosis> diagnoses = diagnosisRule.extract(text);
        List<Procedure> procedures = procedureRule.extract(text);
        List<Medication> medications = medicationRule.extract(text);
        List<TimelineEvent> timeline = timelineRule.extract(text);
        List<MedicalCode> codes = medicalCodeRule.extract(text);

        Map<String, String> sectionTexts = new LinkedHashMap<>();
        for (String section : ClinicalRecord.SOAP_SECTIONS) {
            sectionTexts.put(section, sections.get(section));
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("extractedAt", Instant.now().toString());
        metadata.put("pageCount", extracted.metadata().pageCount());
        metadata.put("extractionMethod", extracted.metadata().method());
        metadata.put("hasNativeText", extracted.metadata().hasNativeText());
        metadata.put("sectionsFound", List.copyOf(sections.keySet()));
        metadata.put("document", documentMetadata == null ? Map.of() : Map.copyOf(documentMetadata));

        ClinicalRecord record = new ClinicalRecord(
                patientId,
                documentId,
                headerExtractor.extractTitle(text),
                headerExtractor.extractDate(text),
                headerExtractor.extractClinician(text),
                injuries,
                diagnoses,
                procedures,
                medications,
                timeline,
                codes,
                sectionTexts,
                narrativeExtractor.extract(text, sections),
                metadata);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put(injuryRule.category(), injuries.size());
        details.put(diagnosisRule.category(), diagnoses.size());
        details.put(procedureRule.category(), procedures.size());
        details.put(medicationRule.category(), medications.size());
        details.put(timelineRule.category(), timeline.size());
        details.put(medicalCodeRule.category(), codes.size());

        log.info("   Facts: {} injuries, {} diagnoses, {} procedures, {} medications, {} timeline, {} codes",
                injuries.size(), diagnoses.size(), procedures.size(), medications.size(),
                timeline.size(), codes.size());

        return StageResult.success(record, details);
    }
}
