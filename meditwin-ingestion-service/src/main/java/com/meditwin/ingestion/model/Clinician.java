package com.meditwin.ingestion.model;

public record Clinician(String name, String role) {

    public static Clinician unknown() {
        return new Clinician(ClinicalRecord.NOT_AVAILABLE, ClinicalRecord.NOT_AVAILABLE);
    }
}
