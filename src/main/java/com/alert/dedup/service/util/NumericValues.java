package com.alert.dedup.service.util;

import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads integer values out of loosely typed alert metadata.
 *
 * Producers send {@code currentValue} as a number, as a numeric string or
 * with a unit suffix ("97%"). Only the leading integer counts; fractions are
 * truncated.
 */
public final class NumericValues {

    private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*([+-]?\\d+)");

    private NumericValues() {
    }

    /**
     * Extracts the leading integer of a metadata value.
     *
     * @param value a number, a string or null
     * @return the integer, or empty when the value has no leading digits
     */
    public static OptionalLong leadingInteger(Object value) {
        if (value == null || value instanceof Boolean) {
            return OptionalLong.empty();
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return OptionalLong.empty();
            }
            return OptionalLong.of(number.longValue());
        }

        Matcher matcher = LEADING_INTEGER.matcher(value.toString());
        if (!matcher.find()) {
            return OptionalLong.empty();
        }
        String digits = matcher.group(1);
        try {
            return OptionalLong.of(Long.parseLong(digits));
        } catch (NumberFormatException e) {
            // saturate on overflow, only the comparison against small thresholds matters
            return OptionalLong.of(digits.startsWith("-") ? Long.MIN_VALUE : Long.MAX_VALUE);
        }
    }
}
