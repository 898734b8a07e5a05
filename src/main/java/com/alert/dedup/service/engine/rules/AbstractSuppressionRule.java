package com.alert.dedup.service.engine.rules;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Objects;
import java.util.Set;

/**
 * Base class holding the name and reason shared by all rule types.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class AbstractSuppressionRule implements SuppressionRule {

    private final String name;
    private final String reason;

    /**
     * Null-safe membership test; {@code Set.of(..).contains(null)} throws.
     */
    protected static boolean isOneOf(String value, Set<String> candidates) {
        return value != null && candidates.contains(value);
    }

    protected static String require(String value, String field) {
        return Objects.requireNonNull(value, () -> "alert has no " + field);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
