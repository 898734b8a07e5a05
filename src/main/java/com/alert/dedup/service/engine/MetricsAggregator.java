package com.alert.dedup.service.engine;

import com.alert.dedup.service.model.ProcessingMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

/**
 * Cumulative pipeline counters and the statistics derived from them.
 *
 * The counters here are resettable and back {@link ProcessingMetrics}
 * snapshots. Every increment is mirrored to a Micrometer counter, which
 * stays monotonic across resets.
 */
@Slf4j
public class MetricsAggregator {

    private final Counter receivedCounter;
    private final Counter duplicatesCounter;
    private final Counter suppressedCounter;
    private final Counter escalatedCounter;
    private final Counter processedCounter;
    private final Timer batchTimer;
    private final MeterRegistry registry;

    private long received;
    private long duplicates;
    private long suppressed;
    private long escalated;
    private long processed;

    public MetricsAggregator(MeterRegistry registry) {
        this.registry = registry;

        this.receivedCounter = Counter.builder("alert.pipeline.received")
                .description("Number of alerts received, malformed entries included")
                .register(registry);

        this.duplicatesCounter = Counter.builder("alert.pipeline.duplicates")
                .description("Number of alerts dropped as duplicates")
                .register(registry);

        this.suppressedCounter = Counter.builder("alert.pipeline.suppressed")
                .description("Number of alerts dropped by suppression rules")
                .register(registry);

        this.escalatedCounter = Counter.builder("alert.pipeline.escalated")
                .description("Number of alerts escalated to operators")
                .register(registry);

        this.processedCounter = Counter.builder("alert.pipeline.processed")
                .description("Number of well-formed alerts run through the pipeline")
                .register(registry);

        this.batchTimer = Timer.builder("alert.pipeline.duration")
                .description("Time taken to process one alert batch")
                .register(registry);
    }

    // ==================== Recording ====================

    public synchronized void recordReceived(int count) {
        received += count;
        receivedCounter.increment(count);
    }

    public synchronized void recordDuplicate() {
        duplicates++;
        duplicatesCounter.increment();
    }

    public synchronized void recordSuppressed() {
        suppressed++;
        suppressedCounter.increment();
    }

    public synchronized void recordEscalated(int count) {
        escalated += count;
        escalatedCounter.increment(count);
    }

    public synchronized void recordProcessed(int count) {
        processed += count;
        processedCounter.increment(count);
    }

    public Timer.Sample startTimer() {
        return Timer.start(registry);
    }

    public void stopTimer(Timer.Sample sample) {
        sample.stop(batchTimer);
    }

    // ==================== Reading ====================

    public synchronized ProcessingMetrics snapshot() {
        return ProcessingMetrics.builder()
                .received(received)
                .duplicates(duplicates)
                .suppressed(suppressed)
                .escalated(escalated)
                .processed(processed)
                .reductionPercentage(percentage(received - escalated, received))
                .duplicateRate(percentage(duplicates, received))
                .suppressionRate(percentage(suppressed, received))
                .build();
    }

    public synchronized void reset() {
        received = 0;
        duplicates = 0;
        suppressed = 0;
        escalated = 0;
        processed = 0;
        log.info("Pipeline metrics reset");
    }

    /**
     * Whole-number percentage of {@code part} in {@code whole}, rounded half up.
     *
     * @return the percentage, or 0 when {@code whole} is 0
     */
    public static int percentage(long part, long whole) {
        if (whole == 0) {
            return 0;
        }
        return (int) Math.round(part * 100.0 / whole);
    }
}
