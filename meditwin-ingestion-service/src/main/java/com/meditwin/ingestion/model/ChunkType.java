package com.meditwin.ingestion.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ChunkType {
    SOAP_SECTION,
    NARRATIVE,
    STRUCTURED_SUMMARY;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
