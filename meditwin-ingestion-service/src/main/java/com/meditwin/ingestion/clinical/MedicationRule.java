package com.meditwin.ingestion.clinical;

import com.meditwin.ingestion.model.ClinicalRecord;
import com.meditwin.ingestion.model.Medication;
import com.meditwin.ingestion.model.SourceRef;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Medications listed on "Medications:", "Prescriptions:" or "Drugs:" lines, split on commas and
 * semicolons. Dosage and frequency are pulled out of each entry; the rest is the drug name.
 */
@Component
public class MedicationRule implements ClinicalFactRule<Medication> {

    static final int MAX_ENTRIES = 10;

    private static final Pattern MEDICATION_LINE = Pattern.compile(
            "\\b(?:medications?|prescriptions?|drugs?)\\s*:\\s*([^\\n\\r]+)", Pattern.CASE_INSENSITIVE);

    private static final Pattern ENTRY_SEPARATOR = Pattern.compile("[,;]");

    private static final Pattern DOSAGE = Pattern.compile(
            "\\b\\d+(?:\\.\\d+)?\\s*(?:mg|mcg|ml|units?)\\b", Pattern.CASE_INSENSITIVE);

    // Most specific phrasing first
    private static final List<Pattern> FREQUENCIES = List.of(
            Pattern.compile("\\b(?:once|twice|three times)\\s+(?:a\\s+|per\\s+)?(?:day|daily)\\b",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b\\d+\\s*times?\\s*(?:per\\s*|a\\s*)?day\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bevery\\s*\\d+\\s*hours?\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:daily|bid|tid|qid|q\\d+h|once|twice|three times|as needed|prn)\\b",
                    Pattern.CASE_INSENSITIVE));

    @Override
    public List<Medication> extract(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<Medication> medications = new ArrayList<>();
        Matcher lineMatcher = MEDICATION_LINE.matcher(text);
        while (lineMatcher.find()) {
            int lineOffset = lineMatcher.start(1);
            String line = lineMatcher.group(1);
            Matcher separators = ENTRY_SEPARATOR.matcher(line);
            int entryStart = 0;
            while (entryStart <= line.length()) {
                int entryEnd = separators.find() ? separators.start() : line.length();
                String entry = line.substring(entryStart, entryEnd).trim();
                if (entry.length() > 2) {
                    int start = lineOffset + entryStart;
                    medications.add(toMedication(entry, new SourceRef(start, lineOffset + entryEnd, entry)));
                    if (medications.size() == MAX_ENTRIES) {
                        return medications;
                    }
                }
                entryStart = entryEnd + 1;
            }
        }
        return medications;
    }

    private Medication toMedication(String entry, SourceRef source) {
        String remainder = entry;

        String dosage = ClinicalRecord.NOT_AVAILABLE;
        Matcher dosageMatcher = DOSAGE.matcher(remainder);
        if (dosageMatcher.find()) {
            dosage = ClinicalPatterns.collapseWhitespace(dosageMatcher.group());
            remainder = remainder.substring(0, dosageMatcher.start()) + " " + remainder.substring(dosageMatcher.end());
        }

        String frequency = ClinicalRecord.NOT_AVAILABLE;
        for (Pattern pattern : FREQUENCIES) {
            Matcher frequencyMatcher = pattern.matcher(remainder);
            if (frequencyMatcher.find()) {
                frequency = ClinicalPatterns.collapseWhitespace(frequencyMatcher.group());
                remainder = remainder.substring(0, frequencyMatcher.start()) + " "
                        + remainder.substring(frequencyMatcher.end());
                break;
            }
        }

        String name = ClinicalPatterns.collapseWhitespace(remainder).replaceAll("[\\s.:-]+$", "");
        if (name.isEmpty()) {
            name = entry;
        }
        return new Medication(name, dosage, frequency, source);
    }

    @Override
    public String category() {
        return "medications";
    }
}
