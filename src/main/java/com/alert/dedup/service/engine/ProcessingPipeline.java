package com.alert.dedup.service.engine;

import com.alert.dedup.service.engine.rules.SuppressionDecision;
import com.alert.dedup.service.engine.rules.SuppressionRuleEngine;
import com.alert.dedup.service.model.Alert;
import com.alert.dedup.service.model.ProcessedAlert;
import com.alert.dedup.service.model.ProcessingMetrics;
import com.alert.dedup.service.model.ProcessingResult;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Alert filtering pipeline: deduplicate, suppress noise, prioritize.
 *
 * One call processes one batch synchronously. Calls on the same instance
 * are serialized, so the dedup store and the counters see a single writer.
 * State accumulates across calls until {@link #resetMetrics()}.
 */
@Slf4j
public class ProcessingPipeline {

    public static final int DEFAULT_RECENT_LIMIT = 10;

    private final FingerprintGenerator fingerprintGenerator = new FingerprintGenerator();
    private final Prioritizer prioritizer = new Prioritizer();
    private final AlertDeduplicator deduplicator;
    private final SuppressionRuleEngine ruleEngine;
    private final CriticalAlertGuard criticalGuard;
    private final MetricsAggregator metrics;
    private final RecentAlertHistory history;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();

    public ProcessingPipeline(PipelineSettings settings) {
        this(settings, new InMemoryDeduplicationStore(), new MetricsAggregator(new SimpleMeterRegistry()), Clock.systemUTC());
    }

    public ProcessingPipeline(PipelineSettings settings, DeduplicationStore store,
                              MetricsAggregator metrics, Clock clock) {
        settings.validate();
        this.deduplicator = new AlertDeduplicator(store, settings.getDeduplicationWindow());
        this.ruleEngine = new SuppressionRuleEngine(settings.getSuppressionRules());
        this.criticalGuard = new CriticalAlertGuard(settings.getCriticalKeywords());
        this.history = new RecentAlertHistory(settings.getRecentHistoryCapacity());
        this.metrics = metrics;
        this.clock = clock;

        log.info("ProcessingPipeline initialized, window: {}s, rules: {}, critical keywords: {}",
                settings.getDeduplicationWindow().getSeconds(),
                settings.getSuppressionRules().size(),
                settings.getCriticalKeywords());
    }

    // ==================== Processing ====================

    /**
     * Runs one batch through deduplication, suppression and prioritization.
     *
     * Null entries and blank alerts are skipped; they count towards
     * {@code originalCount} and {@code received} only.
     *
     * @param alerts the batch, may contain null entries
     * @return the escalated alerts with per-batch and cumulative statistics
     * @throws IllegalArgumentException if {@code alerts} is null
     */
    public ProcessingResult processAlerts(List<Alert> alerts) {
        if (alerts == null) {
            throw new IllegalArgumentException("Alert batch must not be null");
        }

        lock.lock();
        try {
            Timer.Sample sample = metrics.startTimer();
            Instant batchTime = clock.instant();
            log.info("Processing {} alerts", alerts.size());

            metrics.recordReceived(alerts.size());

            List<Alert> wellFormed = dropMalformed(alerts);
            List<ProcessedAlert> deduplicated = deduplicate(wellFormed, batchTime);
            List<ProcessedAlert> filtered = suppressNoise(deduplicated);
            List<ProcessedAlert> prioritized = prioritizer.prioritize(filtered);

            metrics.recordEscalated(prioritized.size());
            metrics.recordProcessed(wellFormed.size());
            history.addAll(prioritized);

            int reduction = MetricsAggregator.percentage(alerts.size() - prioritized.size(), alerts.size());
            log.info("Batch complete: received={}, wellFormed={}, afterDedup={}, escalated={}, reduction={}%",
                    alerts.size(), wellFormed.size(), deduplicated.size(), prioritized.size(), reduction);

            metrics.stopTimer(sample);
            return ProcessingResult.builder()
                    .originalCount(alerts.size())
                    .processedAlerts(prioritized)
                    .metrics(metrics.snapshot())
                    .reductionPercentage(reduction)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    // ==================== State ====================

    /**
     * Zeroes all counters and clears the dedup store and the recent history.
     */
    public void resetMetrics() {
        lock.lock();
        try {
            metrics.reset();
            deduplicator.reset();
            history.clear();
        } finally {
            lock.unlock();
        }
    }

    public ProcessingMetrics getMetrics() {
        lock.lock();
        try {
            return metrics.snapshot();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Gets the most recently escalated alerts, last escalated first.
     *
     * @param limit maximum number of alerts, must be positive
     * @return up to {@code limit} alerts
     */
    public List<ProcessedAlert> getRecentAlerts(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive: " + limit);
        }
        return history.latest(limit);
    }

    public List<ProcessedAlert> getRecentAlerts() {
        return getRecentAlerts(DEFAULT_RECENT_LIMIT);
    }

    public int getRecentHistorySize() {
        return history.size();
    }

    // ==================== Stages ====================

    private List<Alert> dropMalformed(List<Alert> alerts) {
        List<Alert> wellFormed = new ArrayList<>(alerts.size());
        for (int i = 0; i < alerts.size(); i++) {
            Alert alert = alerts.get(i);
            if (alert == null || alert.isBlank()) {
                log.warn("Skipping malformed alert at index {}", i);
                continue;
            }
            wellFormed.add(alert);
        }
        return wellFormed;
    }

    private List<ProcessedAlert> deduplicate(List<Alert> alerts, Instant batchTime) {
        List<ProcessedAlert> novel = new ArrayList<>();
        for (Alert alert : alerts) {
            String fingerprint = fingerprintGenerator.fingerprint(alert);
            if (deduplicator.classify(alert, fingerprint, batchTime).duplicate()) {
                metrics.recordDuplicate();
                continue;
            }
            novel.add(ProcessedAlert.builder()
                    .alert(alert)
                    .fingerprint(fingerprint)
                    .processedAt(batchTime)
                    .build());
        }
        return novel;
    }

    private List<ProcessedAlert> suppressNoise(List<ProcessedAlert> candidates) {
        List<ProcessedAlert> kept = new ArrayList<>();
        for (ProcessedAlert candidate : candidates) {
            Alert alert = candidate.getAlert();
            SuppressionDecision decision = criticalGuard.enforce(alert, ruleEngine.evaluate(alert));

            if (decision.suppress()) {
                metrics.recordSuppressed();
                log.debug("Suppressed: alertId={}, rule={}, reason={}", alert.getId(), decision.ruleName(), decision.reason());
                continue;
            }
            kept.add(ProcessedAlert.builder()
                    .alert(alert)
                    .fingerprint(candidate.getFingerprint())
                    .processedAt(candidate.getProcessedAt())
                    .suppressionReason(ProcessedAlert.NOT_SUPPRESSED)
                    .build());
        }
        return kept;
    }
}
