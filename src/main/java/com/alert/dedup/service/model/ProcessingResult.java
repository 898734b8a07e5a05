package com.alert.dedup.service.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one {@code processAlerts} call.
 */
@Value
@Builder
public class ProcessingResult {

    /**
     * Size of the input batch, malformed entries included.
     */
    int originalCount;

    /**
     * Escalated alerts, highest severity and most recent first.
     */
    List<ProcessedAlert> processedAlerts;

    /**
     * Cumulative metrics after this batch.
     */
    ProcessingMetrics metrics;

    /**
     * Share of this batch that was not escalated, in whole percent.
     */
    int reductionPercentage;
}
