package com.alert.dedup.service.api.dto;

import com.alert.dedup.service.model.ProcessingMetrics;
import com.alert.dedup.service.model.ProcessingResult;
import lombok.Builder;
import lombok.Value;

/**
 * Compact batch summary returned to webhook senders.
 */
@Value
@Builder
public class WebhookSummaryResponse {

    /**
     * Number of entries in the delivered batch.
     */
    int processed;

    /**
     * Number of alerts escalated from the batch.
     */
    int escalated;

    int reductionPercentage;

    ProcessingMetrics metrics;

    public static WebhookSummaryResponse from(ProcessingResult result) {
        return WebhookSummaryResponse.builder()
                .processed(result.getOriginalCount())
                .escalated(result.getProcessedAlerts().size())
                .reductionPercentage(result.getReductionPercentage())
                .metrics(result.getMetrics())
                .build();
    }
}
