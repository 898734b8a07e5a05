package com.alert.dedup.service.engine.rules;

import com.alert.dedup.service.engine.AlertProcessingException;

import java.util.List;

/**
 * Result of evaluating the suppression rules against one alert.
 *
 * @param suppress whether the alert is dropped as noise
 * @param ruleName name of the matching rule, null when not suppressed
 * @param reason   reason of the matching rule, null when not suppressed
 * @param failures rules that threw during evaluation and were skipped
 */
public record SuppressionDecision(
        boolean suppress,
        String ruleName,
        String reason,
        List<AlertProcessingException> failures
) {

    public SuppressionDecision {
        failures = List.copyOf(failures);
    }

    public static SuppressionDecision keep(List<AlertProcessingException> failures) {
        return new SuppressionDecision(false, null, null, failures);
    }

    public static SuppressionDecision suppress(SuppressionRule rule, List<AlertProcessingException> failures) {
        return new SuppressionDecision(true, rule.getName(), rule.getReason(), failures);
    }

    /**
     * Same decision with suppression vetoed and the reason cleared.
     */
    public SuppressionDecision overridden() {
        return keep(failures);
    }
}
