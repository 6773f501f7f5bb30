package com.meditwin.ingestion.clinical;

import com.meditwin.ingestion.model.ClinicalRecord;
import com.meditwin.ingestion.model.Clinician;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Document-level facts: title, date of service and the authoring clinician.
 */
@Component
public class DocumentHeaderExtractor {

    static final String DEFAULT_TITLE = "Medical Document";

    // Phrase to display title, in priority order
    private static final Map<String, String> DOCUMENT_TYPES = new LinkedHashMap<>();

    static {
        DOCUMENT_TYPES.put("soap note", "SOAP Note");
        DOCUMENT_TYPES.put("progress note", "Progress Note");
        DOCUMENT_TYPES.put("consultation", "Consultation");
        DOCUMENT_TYPES.put("discharge summary", "Discharge Summary");
        DOCUMENT_TYPES.put("operative report", "Operative Report");
        DOCUMENT_TYPES.put("pathology report", "Pathology Report");
        DOCUMENT_TYPES.put("radiology report", "Radiology Report");
        DOCUMENT_TYPES.put("emergency department", "Emergency Department Note");
        DOCUMENT_TYPES.put("clinic note", "Clinic Note");
        DOCUMENT_TYPES.put("therapy note", "Therapy Note");
        DOCUMENT_TYPES.put("injury report", "Injury Report");
        DOCUMENT_TYPES.put("evaluation", "Evaluation");
        DOCUMENT_TYPES.put("assessment", "Assessment");
    }

    private static final Pattern DOCTOR = Pattern.compile(
            "\\bDr\\.?\\s+([A-Z][A-Za-z'-]+(?:\\s+[A-Z][A-Za-z'-]+)?)");

    private static final Pattern LABELLED_CLINICIAN = Pattern.compile(
            "\\b(physician|provider|attending|clinician|therapist)\\s*:\\s*([^\\n\\r,]+)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern CREDENTIAL = Pattern.compile("\\b(MD|DO|PT|DPT|NP|PA-C|PA|RN)\\b");

    private static final Map<String, String> CREDENTIAL_ROLES = Map.of(
            "MD", "Physician",
            "DO", "Physician",
            "PT", "Physical Therapist",
            "DPT", "Physical Therapist",
            "NP", "Nurse Practitioner",
            "PA", "Physician Assistant",
            "PA-C", "Physician Assistant",
            "RN", "Registered Nurse");

    private static final int TITLE_SCAN_LINES = 5;

    public String extractTitle(String text) {
        if (text == null || text.isBlank()) {
            return DEFAULT_TITLE;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> type : DOCUMENT_TYPES.entrySet()) {
            if (lower.contains(type.getKey())) {
                return type.getValue();
            }
        }

        List<String> lines = text.lines()
                .map(String::trim)
                .filter(line -> !line.isEmpty() && !line.startsWith("--- Page"))
                .limit(TITLE_SCAN_LINES)
                .toList();
        for (String line : lines) {
            if (line.length() >= 5 && line.length() <= 80 && !ClinicalPatterns.DATE_TOKEN.matcher(line).find()) {
                return line;
            }
        }
        return DEFAULT_TITLE;
    }

    /** Earliest date in numeric, ISO or month-name form */
    public String extractDate(String text) {
        if (text == null || text.isBlank()) {
            return ClinicalRecord.NOT_AVAILABLE;
        }
        String earliest = null;
        int earliestPosition = Integer.MAX_VALUE;
        for (Pattern pattern : List.of(ClinicalPatterns.DATE_TOKEN, ClinicalPatterns.ISO_DATE, ClinicalPatterns.MONTH_DATE)) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find() && matcher.start() < earliestPosition) {
                earliestPosition = matcher.start();
                earliest = matcher.group();
            }
        }
        return earliest == null ? ClinicalRecord.NOT_AVAILABLE : earliest;
    }

    public Clinician extractClinician(String text) {
        if (text == null || text.isBlank()) {
            return Clinician.unknown();
        }

        Matcher labelled = LABELLED_CLINICIAN.matcher(text);
        if (labelled.find()) {
            String name = ClinicalPatterns.collapseWhitespace(labelled.group(2));
            String role = roleFromCredentials(labelled.group(2));
            if (role == null) {
                role = ClinicalPatterns.capitalize(labelled.group(1).toLowerCase(Locale.ROOT));
            }
            return new Clinician(name, role);
        }

        Matcher doctor = DOCTOR.matcher(text);
        if (doctor.find()) {
            String tail = text.substring(doctor.end(), Math.min(text.length(), doctor.end() + 12));
            String role = roleFromCredentials(tail);
            return new Clinician("Dr. " + doctor.group(1), role == null ? "Physician" : role);
        }
        return Clinician.unknown();
    }

    private static String roleFromCredentials(String text) {
        Matcher matcher = CREDENTIAL.matcher(text);
        return matcher.find() ? CREDENTIAL_ROLES.get(matcher.group(1)) : null;
    }
}
