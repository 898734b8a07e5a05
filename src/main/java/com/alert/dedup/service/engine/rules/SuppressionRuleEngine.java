package com.alert.dedup.service.engine.rules;

import com.alert.dedup.service.engine.AlertProcessingException;
import com.alert.dedup.service.model.Alert;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates the ordered suppression rule list against an alert.
 *
 * The first matching rule wins. A rule that throws is logged, reported in
 * the decision and skipped; evaluation continues with the next rule.
 */
@Slf4j
public class SuppressionRuleEngine {

    private final List<SuppressionRule> rules;

    public SuppressionRuleEngine(List<SuppressionRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public SuppressionDecision evaluate(Alert alert) {
        List<AlertProcessingException> failures = new ArrayList<>();

        for (SuppressionRule rule : rules) {
            try {
                if (rule.matches(alert)) {
                    return SuppressionDecision.suppress(rule, failures);
                }
            } catch (RuntimeException e) {
                var failure = new AlertProcessingException(
                        "Suppression rule failed: " + rule.getName(),
                        alert.getId(),
                        AlertProcessingException.SUPPRESSION_RULE_FAILED,
                        e
                );
                log.warn("{} (alertId={}): {}", failure.getMessage(), alert.getId(), e.getMessage());
                failures.add(failure);
            }
        }
        return SuppressionDecision.keep(failures);
    }
}
