package com.meditwin.ingestion.model;

public record InjuryEvent(
        String description,
        String bodyPart,
        String date,
        SeverityLevel severity,
        SourceRef source
) {
}
