package com.alert.dedup.service.engine.rules;

import com.alert.dedup.service.model.Alert;

/**
 * A noise suppression rule.
 *
 * Rules are evaluated in list order by the {@link SuppressionRuleEngine};
 * the first rule that matches decides the suppression reason.
 */
public interface SuppressionRule {

    /**
     * Gets the display name of the rule.
     *
     * @return the rule name
     */
    String getName();

    /**
     * Gets the reason recorded when this rule suppresses an alert.
     *
     * @return the suppression reason
     */
    String getReason();

    /**
     * Checks whether the alert is noise according to this rule.
     *
     * @param alert a well-formed alert
     * @return true if the alert should be suppressed
     * @throws RuntimeException if the alert lacks a field the rule requires;
     *         the engine treats this as a non-match
     */
    boolean matches(Alert alert);
}
