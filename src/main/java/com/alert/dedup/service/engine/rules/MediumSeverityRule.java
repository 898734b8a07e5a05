package com.alert.dedup.service.engine.rules;

import com.alert.dedup.service.model.Alert;
import com.alert.dedup.service.model.Severity;

import java.util.List;
import java.util.Locale;

/**
 * Suppresses MEDIUM alerts that do not affect a service.
 *
 * An alert is service-affecting when its type contains one of the
 * protected type fragments or its message mentions one of the protected
 * keywords. Requires both type and message: an alert missing either makes
 * the rule throw, which the engine counts as a non-match.
 */
public class MediumSeverityRule extends AbstractSuppressionRule {

    private final List<String> protectedTypeFragments;
    private final List<String> protectedMessageKeywords;

    public MediumSeverityRule(String name, String reason,
                              List<String> protectedTypeFragments, List<String> protectedMessageKeywords) {
        super(name, reason);
        this.protectedTypeFragments = List.copyOf(protectedTypeFragments);
        this.protectedMessageKeywords = protectedMessageKeywords.stream()
                .map(keyword -> keyword.toLowerCase(Locale.ROOT))
                .toList();
    }

    @Override
    public boolean matches(Alert alert) {
        if (!Severity.MEDIUM.name().equals(alert.getSeverity())) {
            return false;
        }

        String type = require(alert.getType(), "type");
        if (protectedTypeFragments.stream().anyMatch(type::contains)) {
            return false;
        }

        String message = require(alert.getMessage(), "message").toLowerCase(Locale.ROOT);
        return protectedMessageKeywords.stream().noneMatch(message::contains);
    }
}
