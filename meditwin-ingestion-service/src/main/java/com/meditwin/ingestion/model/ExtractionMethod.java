package com.meditwin.ingestion.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** How the text of a page was obtained */
public enum ExtractionMethod {
    NATIVE,
    OCR,
    NONE;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
