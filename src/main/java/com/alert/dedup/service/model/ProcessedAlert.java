package com.alert.dedup.service.model;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * An escalated alert together with the annotations added by the pipeline.
 */
@Value
@Builder
public class ProcessedAlert {

    public static final String NOT_SUPPRESSED = "Not suppressed";

    @JsonUnwrapped
    Alert alert;

    /**
     * Deduplication key of the alert.
     */
    String fingerprint;

    /**
     * Start time of the batch that accepted the alert.
     */
    Instant processedAt;

    String suppressionReason;
}
