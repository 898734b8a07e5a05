package com.alert.dedup.service.engine.rules;

import com.alert.dedup.service.model.Alert;
import com.alert.dedup.service.util.NumericValues;

import java.util.OptionalLong;
import java.util.Set;

/**
 * Suppresses alerts of one type and a set of severities whose metadata
 * value lies on the harmless side of a threshold.
 *
 * A missing or non-numeric metadata value never matches.
 */
public class ThresholdRule extends AbstractSuppressionRule {

    public static final String CURRENT_VALUE = "currentValue";

    public enum Comparison {
        BELOW,
        ABOVE
    }

    private final String type;
    private final Set<String> severities;
    private final String metadataKey;
    private final Comparison comparison;
    private final long threshold;

    public ThresholdRule(String name, String reason, String type, Set<String> severities,
                         Comparison comparison, long threshold) {
        this(name, reason, type, severities, CURRENT_VALUE, comparison, threshold);
    }

    public ThresholdRule(String name, String reason, String type, Set<String> severities,
                         String metadataKey, Comparison comparison, long threshold) {
        super(name, reason);
        this.type = type;
        this.severities = Set.copyOf(severities);
        this.metadataKey = metadataKey;
        this.comparison = comparison;
        this.threshold = threshold;
    }

    @Override
    public boolean matches(Alert alert) {
        if (!type.equals(alert.getType()) || !isOneOf(alert.getSeverity(), severities)) {
            return false;
        }
        OptionalLong value = NumericValues.leadingInteger(alert.metadataValue(metadataKey));
        if (value.isEmpty()) {
            return false;
        }
        return comparison == Comparison.BELOW
                ? value.getAsLong() < threshold
                : value.getAsLong() > threshold;
    }
}
