package com.meditwin.ingestion.model;

public record PageText(int pageNumber, String text, ExtractionMethod method) {

    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}
