package com.meditwin.ingestion.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one pipeline stage. Stages report failure through this value instead of throwing.
 * The payload feeds the next stage and is not part of the persisted result copy.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class StageResult<T> {

    private final boolean success;
    private final String error;
    private final T payload;
    private final Map<String, Object> details;

    private StageResult(boolean success, String error, T payload, Map<String, Object> details) {
        this.success = success;
        this.error = error;
        this.payload = payload;
        this.details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static <T> StageResult<T> success(T payload) {
        return new StageResult<>(true, null, payload, null);
    }

    public static <T> StageResult<T> success(T payload, Map<String, Object> details) {
        return new StageResult<>(true, null, payload, details);
    }

    public static <T> StageResult<T> failed(String error) {
        return new StageResult<>(false, error, null, null);
    }

    public static <T> StageResult<T> failed(String error, Map<String, Object> details) {
        return new StageResult<>(false, error, null, details);
    }

    /** Same outcome with extra detail entries appended */
    public StageResult<T> withDetails(Map<String, Object> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.putAll(extra);
        return new StageResult<>(success, error, payload, merged);
    }

    public boolean isSuccess() {
        return success;
    }

    public String getError() {
        return error;
    }

    @JsonIgnore
    public T getPayload() {
        return payload;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    @Override
    public String toString() {
        return success ? "StageResult{success, details=" + details + "}" : "StageResult{failed: " + error + "}";
    }
}
