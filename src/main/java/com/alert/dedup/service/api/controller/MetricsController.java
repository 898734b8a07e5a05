package com.alert.dedup.service.api.controller;

import com.alert.dedup.service.api.dto.ApiResponse;
import com.alert.dedup.service.engine.ProcessingPipeline;
import com.alert.dedup.service.model.ProcessingMetrics;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Controller exposing the cumulative pipeline metrics.
 */
@RestController
@Tag(name = "Metrics", description = "Cumulative deduplication and suppression statistics")
@RequiredArgsConstructor
public class MetricsController {

    private final ProcessingPipeline pipeline;

    @GetMapping("/alerts/metrics")
    @Operation(summary = "Get pipeline metrics", description = "Returns counters and reduction rates since the last reset")
    public ResponseEntity<ApiResponse<ProcessingMetrics>> getMetrics() {
        return ResponseEntity.ok(ApiResponse.success(pipeline.getMetrics()));
    }
}
