package com.meditwin.ingestion.clinical;

import com.meditwin.ingestion.model.ClinicalRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Free-text narratives: what the patient reports, how recovery is going and relevant history.
 */
@Component
public class NarrativeExtractor {

    static final int MAX_FEEDBACK = 5;
    static final int MAX_RECOVERY = 3;
    static final int MAX_HISTORY = 5;

    private static final List<Pattern> FEEDBACK_PATTERNS = List.of(
            Pattern.compile("\\bpatient\\s+(?:reports|states|says|describes|notes|complains of)\\s+([^.\\n]+)",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:he|she|they)\\s+(?:reports|states|feels)\\s+([^.\\n]+)",
                    Pattern.CASE_INSENSITIVE));

    private static final Pattern RECOVERY = Pattern.compile(
            "[^.\\n]*\\b(?:improv\\w*|progress\\w*|recover\\w*|better|healing|resolved|resolving)\\b[^.\\n]*",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern HISTORY = Pattern.compile(
            "\\b(?:history of|h/o|previous|prior)\\s+([^.\\n]+)", Pattern.CASE_INSENSITIVE);

    /**
     * @param sections parsed sections, used for the history narrative when a history section exists
     */
    public Map<String, String> extract(String text, Map<String, String> sections) {
        Map<String, String> narratives = new LinkedHashMap<>();
        String safeText = text == null ? "" : text;

        List<String> feedback = new ArrayList<>();
        for (Pattern pattern : FEEDBACK_PATTERNS) {
            Matcher matcher = pattern.matcher(safeText);
            while (matcher.find()) {
                feedback.add(matcher.group(1));
            }
        }
        narratives.put(ClinicalRecord.FEEDBACK, ClinicalPatterns.joinOrNotAvailable(feedback, MAX_FEEDBACK));

        List<String> recovery = new ArrayList<>();
        Matcher recoveryMatcher = RECOVERY.matcher(safeText);
        while (recoveryMatcher.find()) {
            recovery.add(recoveryMatcher.group());
        }
        narratives.put(ClinicalRecord.RECOVERY_PROGRESS, ClinicalPatterns.joinOrNotAvailable(recovery, MAX_RECOVERY));

        List<String> history = new ArrayList<>();
        String historySection = sections == null ? null : sections.get(ClinicalRecord.HISTORY);
        if (historySection != null) {
            history.add(historySection);
        }
        Matcher historyMatcher = HISTORY.matcher(safeText);
        while (historyMatcher.find()) {
            history.add(historyMatcher.group());
        }
        narratives.put(ClinicalRecord.HISTORY, ClinicalPatterns.joinOrNotAvailable(history, MAX_HISTORY));

        return narratives;
    }
}
