package com.meditwin.ingestion.model;

public record ProcessingSummary(
        int textLength,
        int injuryCount,
        int diagnosisCount,
        int procedureCount,
        int medicationCount,
        int embeddingsStored,
        int storesUpdated
) {
    public static ProcessingSummary empty() {
        return new ProcessingSummary(0, 0, 0, 0, 0, 0, 0);
    }
}
