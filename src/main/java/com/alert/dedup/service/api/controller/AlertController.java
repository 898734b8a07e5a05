package com.alert.dedup.service.api.controller;

import com.alert.dedup.service.api.dto.ApiResponse;
import com.alert.dedup.service.engine.ProcessingPipeline;
import com.alert.dedup.service.ingest.AlertPayloadMapper;
import com.alert.dedup.service.model.Alert;
import com.alert.dedup.service.model.ProcessedAlert;
import com.alert.dedup.service.model.ProcessingResult;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Controller for alert batch processing.
 *
 * Handles POST /alerts/process, the recent alerts query and pipeline reset.
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/alerts")
@Tag(name = "Alert Processing", description = "Endpoints for filtering and prioritizing alert batches")
@RequiredArgsConstructor
public class AlertController {

    private final ProcessingPipeline pipeline;
    private final AlertPayloadMapper payloadMapper;

    /**
     * Processes a batch of alerts.
     *
     * @param body a JSON array of alerts, or a single alert object
     * @return the escalated alerts and batch statistics
     */
    @PostMapping("/process")
    @Operation(
            summary = "Process alert batch",
            description = "Deduplicates, suppresses noise and prioritizes a batch of alerts. " +
                    "Malformed entries are skipped and counted in originalCount only."
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Batch processed"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Unreadable request body")
    })
    public ResponseEntity<ApiResponse<ProcessingResult>> processAlerts(@RequestBody JsonNode body) {
        List<Alert> batch = payloadMapper.toBatch(body);
        log.debug("Received alert batch: size={}", batch.size());

        ProcessingResult result = pipeline.processAlerts(batch);
        return ResponseEntity.ok(ApiResponse.success(result));
    }

    @GetMapping("/recent")
    @Operation(summary = "Recent escalated alerts", description = "Returns the most recently escalated alerts, newest first")
    public ResponseEntity<ApiResponse<List<ProcessedAlert>>> getRecentAlerts(
            @Parameter(description = "Maximum number of alerts (1-100)")
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit) {
        return ResponseEntity.ok(ApiResponse.success(pipeline.getRecentAlerts(limit)));
    }

    @PostMapping("/reset")
    @Operation(summary = "Reset pipeline state", description = "Clears metrics, deduplication state and recent history")
    public ResponseEntity<Void> reset() {
        log.info("Resetting pipeline state on request");
        pipeline.resetMetrics();
        return ResponseEntity.noContent().build();
    }
}
