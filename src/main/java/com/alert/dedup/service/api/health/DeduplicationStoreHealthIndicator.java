package com.alert.dedup.service.api.health;

import com.alert.dedup.service.engine.DeduplicationStore;
import com.alert.dedup.service.engine.PipelineSettings;
import com.alert.dedup.service.engine.ProcessingPipeline;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the deduplication state.
 *
 * Reports tracked fingerprints and recent history size for monitoring.
 */
@Component
@RequiredArgsConstructor
public class DeduplicationStoreHealthIndicator implements HealthIndicator {

    private final DeduplicationStore store;
    private final ProcessingPipeline pipeline;
    private final PipelineSettings settings;

    @Override
    public Health health() {
        return Health.up()
                .withDetail("trackedFingerprints", store.size())
                .withDetail("dedupWindowSeconds", settings.getDeduplicationWindow().getSeconds())
                .withDetail("suppressionRules", settings.getSuppressionRules().size())
                .withDetail("recentHistorySize", pipeline.getRecentHistorySize())
                .build();
    }
}
