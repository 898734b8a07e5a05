package com.alert.dedup.service.config;

import com.alert.dedup.service.engine.PipelineSettings;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the alert filtering pipeline.
 *
 * Bound once at startup and turned into an immutable {@link PipelineSettings}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "alert.pipeline")
public class PipelineProperties {

    /**
     * Same-fingerprint alerts closer than this are duplicates (default: 300s).
     */
    private Duration dedupWindow = PipelineSettings.DEFAULT_DEDUPLICATION_WINDOW;

    /**
     * Keywords exempting an alert from suppression, matched ignoring case.
     */
    private List<String> criticalKeywords = new ArrayList<>(PipelineSettings.DEFAULT_CRITICAL_KEYWORDS);

    /**
     * Number of escalated alerts kept for the recent alerts query.
     */
    private int recentHistoryCapacity = PipelineSettings.DEFAULT_RECENT_HISTORY_CAPACITY;

    /**
     * Feature flags for the pipeline stages.
     */
    private Features features = new Features();

    @Getter
    @Setter
    public static class Features {

        /**
         * Enable time-windowed deduplication.
         */
        private boolean deduplicationEnabled = true;

        /**
         * Enable the default noise suppression rules.
         */
        private boolean suppressionEnabled = true;
    }
}
