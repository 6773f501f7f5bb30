package com.meditwin.ingestion.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Final, immutable outcome of one document run. Built once by the orchestrator (or by the worker
 * catch-all) and only ever read afterwards.
 */
public record ProcessingResult(
        String documentId,
        String patientId,
        boolean success,
        PipelineState finalState,
        String message,
        Map<StageName, StageResult<?>> stages,
        ProcessingSummary summary,
        long durationMs
) {
    public static final String GENERIC_FAILURE_MESSAGE = "Document processing failed";

    public ProcessingResult {
        stages = Collections.unmodifiableMap(new LinkedHashMap<>(stages));
        summary = summary == null ? ProcessingSummary.empty() : summary;
    }

    /** Result for a run that died outside the stage contract */
    public static ProcessingResult unexpectedFailure(String documentId, long durationMs) {
        return new ProcessingResult(documentId, null, false, PipelineState.FAILED,
                GENERIC_FAILURE_MESSAGE, Map.of(), ProcessingSummary.empty(), durationMs);
    }
}
