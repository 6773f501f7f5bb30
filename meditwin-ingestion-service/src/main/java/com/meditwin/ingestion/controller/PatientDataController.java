package com.meditwin.ingestion.controller;

import com.meditwin.common.dto.ApiResponse;
import com.meditwin.ingestion.service.PatientDataService;
import com.meditwin.ingestion.storage.BackendOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/patients/me")
public class PatientDataController {

    private final PatientDataService patientDataService;

    public PatientDataController(PatientDataService patientDataService) {
        this.patientDataService = patientDataService;
    }

    /**
     * List the caller's stored clinical records
     */
    @GetMapping("/records")
    public ResponseEntity<ApiResponse<Map<String, Object>>> getRecords(
            @RequestHeader(DocumentProcessingController.CALLER_HEADER) String callerId) {

        List<String> documentIds = patientDataService.listRecords(callerId);

        Map<String, Object> data = Map.of(
                "documents", documentIds,
                "totalCount", documentIds.size()
        );
        return ResponseEntity.ok(ApiResponse.success(data, "Records retrieved successfully"));
    }

    /**
     * Delete everything stored for the caller. 207 when at least one backend could not erase its data.
     */
    @DeleteMapping("/data")
    public ResponseEntity<ApiResponse<Map<String, Object>>> deleteData(
            @RequestHeader(DocumentProcessingController.CALLER_HEADER) String callerId) {

        Map<String, Object> report = patientDataService.deleteAll(callerId);
        boolean incomplete = report.values().stream()
                .anyMatch(value -> value instanceof BackendOutcome outcome
                        && outcome.status() == BackendOutcome.Status.FAILED);
        if (incomplete) {
            log.warn("Patient data deletion incomplete");
            return ResponseEntity.status(HttpStatus.MULTI_STATUS)
                    .body(ApiResponse.failed(report, "Patient data only partially deleted",
                            HttpStatus.MULTI_STATUS.value()));
        }
        return ResponseEntity.ok(ApiResponse.success(report, "Patient data deleted"));
    }
}
