package com.meditwin.ingestion.storage.profile;

import com.meditwin.ingestion.model.ClinicalRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads long-lived lifestyle attributes out of the narrative and section text of a record.
 * Qualifiers such as "quit" or "heavy" only count when they share a sentence with the topic.
 */
@Component
public class LifestyleSignalExtractor {

    public static final String SMOKING_STATUS = "smokingStatus";
    public static final String ALCOHOL_STATUS = "alcoholStatus";
    public static final String EXERCISE_LEVEL = "exerciseLevel";
    public static final String CHRONIC_CONDITIONS = "chronicConditions";

    static final List<String> CHRONIC_CONDITION_TERMS = List.of(
            "diabetes", "hypertension", "heart disease", "arthritis", "asthma",
            "copd", "depression", "anxiety", "obesity", "thyroid");

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("[.!?\\n]+");

    private static final List<String> SMOKING_TERMS = List.of("smoke", "smoking", "tobacco", "cigarette", "nicotine");
    private static final List<String> ALCOHOL_TERMS = List.of("alcohol", "drinking", "drinks", "beer", "wine", "liquor");
    private static final List<String> EXERCISE_TERMS = List.of("exercise", "workout", "gym", "running", "training", "athletic");

    public Map<String, Object> extract(ClinicalRecord record) {
        List<String> sentences = sentences(corpus(record));
        Map<String, Object> signals = new LinkedHashMap<>();

        List<String> smoking = mentioning(sentences, SMOKING_TERMS);
        if (!smoking.isEmpty()) {
            if (anyContains(smoking, "quit", "stopped", "former", "ex-smoker")) {
                signals.put(SMOKING_STATUS, "former_smoker");
            } else if (anyContains(smoking, "current", "active", "still smoking", "daily")) {
                signals.put(SMOKING_STATUS, "current_smoker");
            } else {
                signals.put(SMOKING_STATUS, "smoking_history");
            }
        }

        List<String> alcohol = mentioning(sentences, ALCOHOL_TERMS);
        if (!alcohol.isEmpty()) {
            if (anyContains(alcohol, "excessive", "heavy", "problem", "abuse")) {
                signals.put(ALCOHOL_STATUS, "excessive_use");
            } else if (anyContains(alcohol, "social", "occasional", "moderate")) {
                signals.put(ALCOHOL_STATUS, "social_drinker");
            } else {
                signals.put(ALCOHOL_STATUS, "alcohol_use");
            }
        }

        // "inactive" contains "active", so sedentary wins first
        List<String> exercise = mentioning(sentences, EXERCISE_TERMS);
        if (!exercise.isEmpty()) {
            if (anyContains(exercise, "sedentary", "inactive", "no exercise")) {
                signals.put(EXERCISE_LEVEL, "sedentary");
            } else if (anyContains(exercise, "regular", "active", "frequent")) {
                signals.put(EXERCISE_LEVEL, "active");
            } else {
                signals.put(EXERCISE_LEVEL, "moderate");
            }
        }

        List<String> conditions = new ArrayList<>();
        String corpus = String.join(" ", sentences);
        for (String condition : CHRONIC_CONDITION_TERMS) {
            if (corpus.contains(condition)) {
                conditions.add(condition);
            }
        }
        if (!conditions.isEmpty()) {
            signals.put(CHRONIC_CONDITIONS, conditions);
        }
        return signals;
    }

    private static String corpus(ClinicalRecord record) {
        StringBuilder text = new StringBuilder();
        record.sectionTexts().values().forEach(value -> appendAvailable(text, value));
        record.narrativeTexts().values().forEach(value -> appendAvailable(text, value));
        return text.toString().toLowerCase(Locale.ROOT);
    }

    private static void appendAvailable(StringBuilder text, String value) {
        if (ClinicalRecord.isAvailable(value)) {
            text.append(value).append('\n');
        }
    }

    private static List<String> sentences(String text) {
        List<String> result = new ArrayList<>();
        for (String sentence : SENTENCE_BOUNDARY.split(text)) {
            if (!sentence.isBlank()) {
                result.add(sentence.trim());
            }
        }
        return result;
    }

    private static List<String> mentioning(List<String> sentences, List<String> terms) {
        return sentences.stream()
                .filter(sentence -> terms.stream().anyMatch(sentence::contains))
                .toList();
    }

    private static boolean anyContains(List<String> sentences, String... qualifiers) {
        for (String sentence : sentences) {
            for (String qualifier : qualifiers) {
                if (sentence.contains(qualifier)) {
                    return true;
                }
            }
        }
        return false;
    }
}
