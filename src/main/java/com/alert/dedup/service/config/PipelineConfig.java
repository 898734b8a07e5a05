package com.alert.dedup.service.config;

import com.alert.dedup.service.engine.DeduplicationStore;
import com.alert.dedup.service.engine.InMemoryDeduplicationStore;
import com.alert.dedup.service.engine.MetricsAggregator;
import com.alert.dedup.service.engine.PipelineSettings;
import com.alert.dedup.service.engine.ProcessingPipeline;
import com.alert.dedup.service.engine.rules.DefaultSuppressionRules;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Configuration for the alert filtering pipeline beans.
 *
 * The pipeline classes are plain Java; this class builds them from
 * {@link PipelineProperties} and registers them for injection.
 */
@Slf4j
@Configuration
public class PipelineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Fingerprint store shared by all batches until reset.
     */
    @Bean
    public DeduplicationStore deduplicationStore(MetricsConfig metricsConfig) {
        log.info("Initializing in-memory deduplication store");
        var store = new InMemoryDeduplicationStore();
        metricsConfig.registerStoreGauge(
                "alert.dedup.fingerprints.count",
                "Number of fingerprints tracked for deduplication",
                store::size
        );
        return store;
    }

    @Bean
    public PipelineSettings pipelineSettings(PipelineProperties properties) {
        var features = properties.getFeatures();

        Duration window = features.isDeduplicationEnabled() ? properties.getDedupWindow() : Duration.ZERO;
        if (!features.isDeduplicationEnabled()) {
            log.warn("Deduplication disabled, every alert is treated as novel");
        }
        if (!features.isSuppressionEnabled()) {
            log.warn("Noise suppression disabled, no suppression rules loaded");
        }

        return PipelineSettings.builder()
                .deduplicationWindow(window)
                .criticalKeywords(List.copyOf(properties.getCriticalKeywords()))
                .suppressionRules(features.isSuppressionEnabled() ? DefaultSuppressionRules.create() : List.of())
                .recentHistoryCapacity(properties.getRecentHistoryCapacity())
                .build();
    }

    @Bean
    public ProcessingPipeline processingPipeline(PipelineSettings settings, DeduplicationStore store,
                                                 MetricsAggregator metricsAggregator, Clock clock,
                                                 MetricsConfig metricsConfig) {
        var pipeline = new ProcessingPipeline(settings, store, metricsAggregator, clock);
        metricsConfig.registerStoreGauge(
                "alert.history.count",
                "Number of escalated alerts kept in the recent history",
                pipeline::getRecentHistorySize
        );
        return pipeline;
    }
}
