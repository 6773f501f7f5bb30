package com.meditwin.ingestion.model;

public record Procedure(
        String name,
        String date,
        String outcome,
        SourceRef source
) {
}
