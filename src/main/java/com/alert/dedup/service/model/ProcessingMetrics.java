package com.alert.dedup.service.model;

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time snapshot of the cumulative pipeline counters.
 *
 * Rates are whole percentages of {@code received}, 0 when nothing was received.
 */
@Value
@Builder
public class ProcessingMetrics {

    long received;
    long duplicates;
    long suppressed;
    long escalated;
    long processed;

    int reductionPercentage;
    int duplicateRate;
    int suppressionRate;

    public static ProcessingMetrics empty() {
        return ProcessingMetrics.builder().build();
    }
}
