package com.meditwin.ingestion.model;

/**
 * Provenance of an extracted fact: the matched span in the full text and the surrounding context.
 */
public record SourceRef(int start, int end, String context) {

    public static SourceRef of(String text, int start, int end, int before, int after) {
        int from = Math.max(0, start - before);
        int to = Math.min(text.length(), end + after);
        return new SourceRef(start, end, text.substring(from, to).trim());
    }
}
