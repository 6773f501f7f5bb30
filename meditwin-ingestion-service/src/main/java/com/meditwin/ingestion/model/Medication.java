package com.meditwin.ingestion.model;

public record Medication(
        String name,
        String dosage,
        String frequency,
        SourceRef source
) {
}
