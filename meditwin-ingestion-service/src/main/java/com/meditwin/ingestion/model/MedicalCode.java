package com.meditwin.ingestion.model;

public record MedicalCode(CodeSystem system, String code, String description, SourceRef source) {

    public enum CodeSystem {
        ICD,
        CPT
    }
}
