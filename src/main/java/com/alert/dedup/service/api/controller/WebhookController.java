package com.alert.dedup.service.api.controller;

import com.alert.dedup.service.api.dto.ApiResponse;
import com.alert.dedup.service.api.dto.WebhookSummaryResponse;
import com.alert.dedup.service.engine.ProcessingPipeline;
import com.alert.dedup.service.ingest.AlertPayloadMapper;
import com.alert.dedup.service.model.ProcessingResult;
import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Controller for alert webhooks from monitoring systems.
 *
 * Handles POST /webhook and answers with a compact summary instead of the
 * escalated alerts.
 */
@Slf4j
@RestController
@Tag(name = "Webhook", description = "Alert delivery endpoint for monitoring systems")
@RequiredArgsConstructor
public class WebhookController {

    private final ProcessingPipeline pipeline;
    private final AlertPayloadMapper payloadMapper;

    @PostMapping("/webhook")
    @Operation(summary = "Receive alerts", description = "Processes a webhook delivery of one alert or an array of alerts")
    public ResponseEntity<ApiResponse<WebhookSummaryResponse>> receive(@RequestBody JsonNode body) {
        var batch = payloadMapper.toBatch(body);
        log.info("Webhook received {} alerts", batch.size());

        ProcessingResult result = pipeline.processAlerts(batch);
        return ResponseEntity.ok(ApiResponse.success(WebhookSummaryResponse.from(result)));
    }
}
