package com.meditwin.ingestion.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ExtractedText(
        String fullText,
        List<PageText> pages,
        Map<String, String> sections,
        ExtractionMetadata metadata
) {
    public ExtractedText {
        pages = List.copyOf(pages);
        sections = Collections.unmodifiableMap(new LinkedHashMap<>(sections));
    }

    public ExtractedText withSections(Map<String, String> parsedSections) {
        return new ExtractedText(fullText, pages, parsedSections, metadata);
    }

    public boolean isEmpty() {
        return fullText == null || fullText.isBlank();
    }
}
