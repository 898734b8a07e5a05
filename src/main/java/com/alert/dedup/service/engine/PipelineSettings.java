package com.alert.dedup.service.engine;

import com.alert.dedup.service.engine.rules.DefaultSuppressionRules;
import com.alert.dedup.service.engine.rules.SuppressionRule;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable pipeline configuration, resolved once when the pipeline is built.
 */
@Value
@Builder(toBuilder = true)
public class PipelineSettings {

    public static final Duration DEFAULT_DEDUPLICATION_WINDOW = Duration.ofSeconds(300);
    public static final List<String> DEFAULT_CRITICAL_KEYWORDS = List.of("critical", "outage", "down", "failed");
    public static final int DEFAULT_RECENT_HISTORY_CAPACITY = 1000;

    /**
     * Same-fingerprint alerts closer than this, in whole seconds, are duplicates.
     * {@link Duration#ZERO} disables deduplication.
     */
    @Builder.Default
    Duration deduplicationWindow = DEFAULT_DEDUPLICATION_WINDOW;

    /**
     * Keywords that make an alert critical and exempt it from suppression.
     */
    @Builder.Default
    List<String> criticalKeywords = DEFAULT_CRITICAL_KEYWORDS;

    /**
     * Suppression rules in evaluation order.
     */
    @Builder.Default
    List<SuppressionRule> suppressionRules = DefaultSuppressionRules.create();

    @Builder.Default
    int recentHistoryCapacity = DEFAULT_RECENT_HISTORY_CAPACITY;

    public static PipelineSettings defaults() {
        return PipelineSettings.builder().build();
    }

    /**
     * Checks the settings for values the pipeline cannot run with.
     *
     * @throws IllegalArgumentException if a value is missing or out of range
     */
    public void validate() {
        if (deduplicationWindow == null || deduplicationWindow.isNegative()) {
            throw new IllegalArgumentException("Deduplication window must be zero or positive: " + deduplicationWindow);
        }
        if (criticalKeywords == null || criticalKeywords.stream().anyMatch(k -> k == null || k.isEmpty())) {
            throw new IllegalArgumentException("Critical keywords must be non-empty strings: " + criticalKeywords);
        }
        if (suppressionRules == null || suppressionRules.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Suppression rules must not be null");
        }
        if (recentHistoryCapacity <= 0) {
            throw new IllegalArgumentException("Recent history capacity must be positive: " + recentHistoryCapacity);
        }
    }
}
