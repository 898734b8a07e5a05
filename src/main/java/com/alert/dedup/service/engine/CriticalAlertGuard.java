package com.alert.dedup.service.engine;

import com.alert.dedup.service.engine.rules.SuppressionDecision;
import com.alert.dedup.service.model.Alert;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Vetoes suppression of safety-relevant alerts.
 *
 * An alert is critical when its message or type contains one of the
 * configured keywords, ignoring case. No critical alert is ever dropped by
 * a suppression rule.
 */
@Slf4j
public class CriticalAlertGuard {

    private final List<String> keywords;

    public CriticalAlertGuard(Collection<String> keywords) {
        this.keywords = keywords.stream()
                .map(keyword -> keyword.toLowerCase(Locale.ROOT))
                .toList();
    }

    public boolean isCritical(Alert alert) {
        String text = (alert.getMessageOrDefault() + " " + (alert.getType() != null ? alert.getType() : ""))
                .toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(text::contains);
    }

    /**
     * Applies the critical override to a suppression decision.
     *
     * @param alert the evaluated alert
     * @param decision the decision of the rule engine
     * @return the decision, with suppression cleared if the alert is critical
     */
    public SuppressionDecision enforce(Alert alert, SuppressionDecision decision) {
        if (!isCritical(alert)) {
            return decision;
        }
        if (decision.suppress()) {
            log.info("Critical override: keeping alert {} despite rule '{}'", alert.getId(), decision.ruleName());
        }
        return decision.overridden();
    }
}
