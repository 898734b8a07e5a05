package com.alert.dedup.service.engine;

import com.alert.dedup.service.model.Alert;
import com.alert.dedup.service.util.TimestampParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Time-windowed deduplication stage.
 *
 * Resolves the alert time, substituting the batch time for an absent or
 * unparsable timestamp, and classifies the alert against the store.
 */
@Slf4j
@RequiredArgsConstructor
public class AlertDeduplicator {

    private final DeduplicationStore store;
    private final Duration window;

    /**
     * Classifies an alert as duplicate or novel, recording novel alerts.
     *
     * @param alert a well-formed alert
     * @param fingerprint the alert fingerprint
     * @param batchTime fallback time for alerts without a usable timestamp
     * @return the classification
     */
    public Classification classify(Alert alert, String fingerprint, Instant batchTime) {
        Instant alertTime = resolveAlertTime(alert, batchTime);
        boolean novel = store.recordIfNovel(fingerprint, alertTime, window);

        if (!novel) {
            log.debug("Duplicate detected: fingerprint={}, alertId={}, message={}",
                    fingerprint, alert.getId(), alert.getMessage());
        }
        return new Classification(!novel, alertTime);
    }

    public void reset() {
        store.clear();
    }

    private Instant resolveAlertTime(Alert alert, Instant batchTime) {
        Optional<Instant> parsed = TimestampParser.parse(alert.getTimestamp());
        if (parsed.isEmpty()) {
            log.warn("Invalid timestamp, using current time: alertId={}, timestamp={}",
                    alert.getId(), alert.getTimestamp());
            return batchTime;
        }
        return parsed.get();
    }

    /**
     * Outcome of a deduplication check.
     *
     * @param duplicate whether the alert repeats a recent one
     * @param alertTime the time the alert was classified under
     */
    public record Classification(boolean duplicate, Instant alertTime) {
    }
}
