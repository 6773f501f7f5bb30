package com.meditwin.ingestion.extraction;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits note text into named clinical sections by trigger phrase.
 *
 * Every trigger is matched at word boundaries and the first usable occurrence of each one is kept.
 * An occurrence inside a longer trigger (for example "history:" inside "past medical history:") is not
 * usable, so the next occurrence of that trigger is taken instead. Hits are ordered by position and
 * each section runs from the end of its trigger to the start of the next hit. When no trigger occurs,
 * the whole text is returned under {@link #GENERIC_SECTION}.
 */
@Component
public class SectionParser {

    public static final String GENERIC_SECTION = "full_text";

    private static final Map<String, List<String>> SECTION_TRIGGERS = new LinkedHashMap<>();

    static {
        SECTION_TRIGGERS.put("subjective", List.of(
                "subjective:", "chief complaint:", "history:", "patient reports:"));
        SECTION_TRIGGERS.put("objective", List.of(
                "objective:", "physical exam:", "examination:", "vital signs:"));
        SECTION_TRIGGERS.put("assessment", List.of(
                "assessment:", "diagnosis:", "impression:", "diagnoses:"));
        SECTION_TRIGGERS.put("plan", List.of(
                "plan:", "treatment:", "recommendations:", "follow-up:"));
        SECTION_TRIGGERS.put("history", List.of(
                "medical history:", "past medical history:", "pmh:", "hpi:"));
        SECTION_TRIGGERS.put("medications", List.of(
                "medications:", "current medications:", "meds:", "prescriptions:"));
        SECTION_TRIGGERS.put("allergies", List.of(
                "allergies:", "drug allergies:", "nkda:", "nka:"));
    }

    private static final List<Trigger> TRIGGERS = compileTriggers();

    public Map<String, String> parse(String text) {
        Map<String, String> sections = new LinkedHashMap<>();
        if (text == null || text.isBlank()) {
            sections.put(GENERIC_SECTION, "");
            return sections;
        }

        List<Hit> hits = acceptedHits(text);
        for (int i = 0; i < hits.size(); i++) {
            Hit hit = hits.get(i);
            int end = i + 1 < hits.size() ? hits.get(i + 1).start() : text.length();
            String content = text.substring(hit.contentStart(), end).trim();
            if (!content.isEmpty()) {
                sections.merge(hit.section(), content, (existing, more) -> existing + "\n" + more);
            }
        }

        if (sections.isEmpty()) {
            sections.put(GENERIC_SECTION, text.trim());
        }
        return sections;
    }

    public static List<String> sectionNames() {
        return List.copyOf(SECTION_TRIGGERS.keySet());
    }

    private List<Hit> acceptedHits(String text) {
        List<Hit> hits = new ArrayList<>();
        for (Trigger trigger : TRIGGERS) {
            Matcher matcher = trigger.pattern().matcher(text);
            while (matcher.find()) {
                hits.add(new Hit(matcher.start(), matcher.end(), trigger.section(), trigger.phrase()));
            }
        }
        // Longest trigger first at equal positions
        hits.sort(Comparator.comparingInt(Hit::start)
                .thenComparing(Comparator.comparingInt(Hit::contentStart).reversed()));

        List<Hit> accepted = new ArrayList<>();
        Set<String> usedPhrases = new HashSet<>();
        int coveredUntil = -1;
        for (Hit hit : hits) {
            if (hit.start() < coveredUntil) {
                continue;
            }
            coveredUntil = hit.contentStart();
            if (usedPhrases.add(hit.phrase())) {
                accepted.add(hit);
            }
        }
        return accepted;
    }

    private static List<Trigger> compileTriggers() {
        List<Trigger> triggers = new ArrayList<>();
        SECTION_TRIGGERS.forEach((section, phrases) -> phrases.forEach(phrase -> triggers.add(
                new Trigger(section, phrase,
                        Pattern.compile("\\b" + Pattern.quote(phrase), Pattern.CASE_INSENSITIVE)))));
        return List.copyOf(triggers);
    }

    private record Trigger(String section, String phrase, Pattern pattern) {
    }

    private record Hit(int start, int contentStart, String section, String phrase) {
    }
}
