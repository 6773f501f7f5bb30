package com.meditwin.ingestion.extraction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SectionParser: trigger matching, ordering, overlap resolution and the generic fallback.
 */
class SectionParserTest {

    private final SectionParser parser = new SectionParser();

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // SOAP Sections
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should slice a SOAP note into its four sections")
    void parse_shouldSplitSoapNote() {
        String note = """
                Subjective: Patient reports left knee pain after a fall.
                Objective: Swelling over the left knee, range of motion reduced.
                Assessment: Knee sprain.
                Plan: Rest, ice and follow up in two weeks.
                """;

        Map<String, String> sections = parser.parse(note);

        assertEquals("Patient reports left knee pain after a fall.", sections.get("subjective"));
        assertEquals("Swelling over the left knee, range of motion reduced.", sections.get("objective"));
        assertEquals("Knee sprain.", sections.get("assessment"));
        assertEquals("Rest, ice and follow up in two weeks.", sections.get("plan"));
        assertFalse(sections.containsKey(SectionParser.GENERIC_SECTION));
    }

    @Test
    @DisplayName("Should match triggers case-insensitively and keep document order")
    void parse_shouldBeCaseInsensitive() {
        Map<String, String> sections = parser.parse("PLAN: physio twice weekly\nCHIEF COMPLAINT: back pain");

        assertEquals("physio twice weekly", sections.get("plan"));
        assertEquals("back pain", sections.get("subjective"));
        assertEquals(java.util.List.of("plan", "subjective"), java.util.List.copyOf(sections.keySet()));
    }

    @Test
    @DisplayName("Should prefer the longest trigger when triggers overlap")
    void parse_shouldResolveOverlappingTriggers() {
        Map<String, String> sections = parser.parse("Past Medical History: asthma since childhood");

        assertEquals("asthma since childhood", sections.get("history"));
        assertFalse(sections.containsKey("subjective"));
    }

    @Test
    @DisplayName("Should find a trigger again after its first occurrence sat inside a longer one")
    void parse_shouldUseLaterOccurrenceOfShadowedTrigger() {
        Map<String, String> sections = parser.parse(
                "Past Medical History: asthma\nSubjective: knee pain\nHistory: fell while hiking\nPlan: rest");

        assertEquals("asthma", sections.get("history"));
        assertEquals("knee pain\nfell while hiking", sections.get("subjective"));
        assertEquals("rest", sections.get("plan"));
    }

    @Test
    @DisplayName("Should only split on the first usable occurrence of a trigger")
    void parse_shouldIgnoreRepeatedTrigger() {
        Map<String, String> sections = parser.parse("Plan: rest\nAssessment: sprain\nPlan: ice");

        assertEquals("rest", sections.get("plan"));
        assertEquals("sprain\nPlan: ice", sections.get("assessment"));
    }

    @Test
    @DisplayName("Should concatenate repeated hits for the same section")
    void parse_shouldMergeRepeatedSections() {
        Map<String, String> sections = parser.parse(
                "Subjective: sore shoulder\nObjective: tender\nPatient reports: worse at night");

        assertEquals("sore shoulder\nworse at night", sections.get("subjective"));
    }

    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━
    // Fallbacks
    // ━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━━

    @Test
    @DisplayName("Should store the whole text under full_text when no trigger is found")
    void parse_shouldFallBackToGenericSection() {
        Map<String, String> sections = parser.parse("  Free text note without any headings.  ");

        assertEquals(1, sections.size());
        assertEquals("Free text note without any headings.", sections.get(SectionParser.GENERIC_SECTION));
    }

    @Test
    @DisplayName("Should never fail on blank input")
    void parse_shouldHandleBlankInput() {
        assertEquals(Map.of(SectionParser.GENERIC_SECTION, ""), parser.parse(""));
        assertEquals(Map.of(SectionParser.GENERIC_SECTION, ""), parser.parse(null));
    }
}
