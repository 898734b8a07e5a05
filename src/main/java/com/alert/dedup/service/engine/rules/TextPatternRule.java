package com.alert.dedup.service.engine.rules;

import com.alert.dedup.service.model.Alert;

import java.util.List;
import java.util.Locale;

/**
 * Suppresses alerts whose message or type contains one of a set of
 * fragments, ignoring case. Absent text is treated as empty.
 */
public class TextPatternRule extends AbstractSuppressionRule {

    private final List<String> messageFragments;
    private final List<String> typeFragments;

    public TextPatternRule(String name, String reason, List<String> messageFragments, List<String> typeFragments) {
        super(name, reason);
        this.messageFragments = lowerCase(messageFragments);
        this.typeFragments = lowerCase(typeFragments);
    }

    @Override
    public boolean matches(Alert alert) {
        String message = alert.getMessageOrDefault().toLowerCase(Locale.ROOT);
        String type = alert.getType() != null ? alert.getType().toLowerCase(Locale.ROOT) : "";

        return messageFragments.stream().anyMatch(message::contains)
                || typeFragments.stream().anyMatch(type::contains);
    }

    private static List<String> lowerCase(List<String> fragments) {
        return fragments.stream()
                .map(fragment -> fragment.toLowerCase(Locale.ROOT))
                .toList();
    }
}
