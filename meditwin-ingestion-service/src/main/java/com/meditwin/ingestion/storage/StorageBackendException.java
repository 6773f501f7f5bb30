package com.meditwin.ingestion.storage;

/**
 * A single backend could not complete an operation. The coordinator records it against that backend
 * only.
 */
public class StorageBackendException extends RuntimeException {

    private final BackendType backend;

    public StorageBackendException(BackendType backend, String message, Throwable cause) {
        super(message, cause);
        this.backend = backend;
    }

    public StorageBackendException(BackendType backend, String message) {
        super(message);
        this.backend = backend;
    }

    public BackendType getBackend() {
        return backend;
    }
}
