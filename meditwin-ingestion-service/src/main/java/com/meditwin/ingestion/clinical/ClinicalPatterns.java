package com.meditwin.ingestion.clinical;

import com.meditwin.ingestion.model.ClinicalRecord;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Patterns and small text helpers shared by the rules.
 */
final class ClinicalPatterns {

    /** Numeric dates such as 3/14/2024 or 14-03-24 */
    static final Pattern DATE_TOKEN = Pattern.compile("\\b\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4}\\b");

    static final Pattern ISO_DATE = Pattern.compile("\\b\\d{4}-\\d{2}-\\d{2}\\b");

    static final Pattern MONTH_DATE = Pattern.compile(
            "\\b(?:jan|feb|mar|apr|may|jun|jul|aug|sep|sept|oct|nov|dec)[a-z]*\\.?\\s+\\d{1,2},?\\s+\\d{4}\\b",
            Pattern.CASE_INSENSITIVE);

    static final String NARRATIVE_SEPARATOR = " | ";

    private ClinicalPatterns() {
    }

    static String firstDateToken(String text) {
        Matcher matcher = DATE_TOKEN.matcher(text);
        return matcher.find() ? matcher.group() : ClinicalRecord.NOT_AVAILABLE;
    }

    static String collapseWhitespace(String value) {
        return value.replaceAll("\\s+", " ").trim();
    }

    /** Join distinct non-blank fragments, or the sentinel when there are none */
    static String joinOrNotAvailable(List<String> fragments, int limit) {
        Set<String> distinct = new LinkedHashSet<>();
        for (String fragment : fragments) {
            String cleaned = collapseWhitespace(fragment);
            if (!cleaned.isEmpty()) {
                distinct.add(cleaned);
            }
        }
        if (distinct.isEmpty()) {
            return ClinicalRecord.NOT_AVAILABLE;
        }
        List<String> kept = new ArrayList<>(distinct);
        return String.join(NARRATIVE_SEPARATOR, kept.subList(0, Math.min(limit, kept.size())));
    }

    static String capitalize(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
