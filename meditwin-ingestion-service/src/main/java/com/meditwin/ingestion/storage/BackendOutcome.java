package com.meditwin.ingestion.storage;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BackendOutcome(BackendType backend, Status status, long itemsWritten, String error) {

    public enum Status {
        SUCCEEDED,
        FAILED,
        SKIPPED
    }

    public static BackendOutcome succeeded(BackendType backend, long itemsWritten) {
        return new BackendOutcome(backend, Status.SUCCEEDED, itemsWritten, null);
    }

    public static BackendOutcome failed(BackendType backend, String error) {
        return new BackendOutcome(backend, Status.FAILED, 0, error);
    }

    public static BackendOutcome skipped(BackendType backend, String reason) {
        return new BackendOutcome(backend, Status.SKIPPED, 0, reason);
    }

    public boolean isSucceeded() {
        return status == Status.SUCCEEDED;
    }
}
