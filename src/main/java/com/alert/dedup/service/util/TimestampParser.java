package com.alert.dedup.service.util;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.chrono.IsoChronology;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Lenient parser for the timestamp formats alert producers send.
 *
 * Accepted, in order: epoch milliseconds, ISO-8601 date-time with offset
 * or zone designator, ISO-8601 local date-time and plain ISO-8601 date. The
 * date and time may be separated by {@code T} or a space
 * ({@code 2024-01-15 10:30:00}). Local values are read as UTC.
 */
public final class TimestampParser {

    private static final Pattern EPOCH_MILLIS = Pattern.compile("-?\\d{1,18}");

    private static final DateTimeFormatter DATE_TIME = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffsetId().optionalEnd()
            .toFormatter(Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT)
            .withChronology(IsoChronology.INSTANCE);

    private static final List<Function<String, Instant>> ISO_PARSERS = List.of(
            value -> OffsetDateTime.parse(value, DATE_TIME).toInstant(),
            value -> LocalDateTime.parse(value, DATE_TIME).toInstant(ZoneOffset.UTC),
            value -> LocalDate.parse(value).atStartOfDay().toInstant(ZoneOffset.UTC)
    );

    private TimestampParser() {
    }

    /**
     * Parses a raw timestamp.
     *
     * @param raw the raw value, may be null
     * @return the instant, or empty if the value is absent or not understood
     */
    public static Optional<Instant> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();

        if (EPOCH_MILLIS.matcher(value).matches()) {
            return Optional.of(Instant.ofEpochMilli(Long.parseLong(value)));
        }

        return ISO_PARSERS.stream()
                .map(parser -> tryParse(parser, value))
                .filter(Objects::nonNull)
                .findFirst();
    }

    private static Instant tryParse(Function<String, Instant> parser, String value) {
        try {
            return parser.apply(value);
        } catch (DateTimeException e) {
            return null;
        }
    }
}
