package com.alert.dedup.service.engine.rules;

import com.alert.dedup.service.model.Alert;

import java.util.List;
import java.util.Set;

/**
 * Suppresses alerts matching any of a list of type/severity clauses.
 */
public class TypeSeverityRule extends AbstractSuppressionRule {

    private final List<Clause> clauses;

    public TypeSeverityRule(String name, String reason, List<Clause> clauses) {
        super(name, reason);
        this.clauses = List.copyOf(clauses);
    }

    @Override
    public boolean matches(Alert alert) {
        return clauses.stream().anyMatch(clause -> clause.matches(alert));
    }

    /**
     * Type must be one of {@code types}; severity must be in
     * {@code severities}, or outside it when {@code excluding} is set.
     * An absent severity counts as outside every set.
     */
    public record Clause(Set<String> types, Set<String> severities, boolean excluding) {

        public static Clause of(Set<String> types, Set<String> severities) {
            return new Clause(types, severities, false);
        }

        public static Clause excluding(Set<String> types, Set<String> severities) {
            return new Clause(types, severities, true);
        }

        boolean matches(Alert alert) {
            if (!isOneOf(alert.getType(), types)) {
                return false;
            }
            boolean listed = isOneOf(alert.getSeverity(), severities);
            return excluding != listed;
        }
    }
}
