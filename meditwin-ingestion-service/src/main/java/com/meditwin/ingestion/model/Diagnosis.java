package com.meditwin.ingestion.model;

public record Diagnosis(
        String name,
        String code,
        String dateDiagnosed,
        String status,
        SourceRef source
) {
}
