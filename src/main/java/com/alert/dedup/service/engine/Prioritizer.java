package com.alert.dedup.service.engine;

import com.alert.dedup.service.model.ProcessedAlert;
import com.alert.dedup.service.model.Severity;
import com.alert.dedup.service.util.TimestampParser;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Orders escalated alerts by severity rank, then by timestamp, newest first.
 *
 * The sort is stable. Alerts without a usable timestamp come after the dated
 * alerts of the same rank.
 */
public class Prioritizer {

    private static final Comparator<Ranked> ORDER = Comparator
            .comparingInt(Ranked::rank).reversed()
            .thenComparing(Ranked::time, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    public List<ProcessedAlert> prioritize(List<ProcessedAlert> alerts) {
        return alerts.stream()
                .map(Prioritizer::rank)
                .sorted(ORDER)
                .map(Ranked::alert)
                .toList();
    }

    private static Ranked rank(ProcessedAlert processed) {
        return new Ranked(
                processed,
                Severity.rankOf(processed.getAlert().getSeverity()),
                TimestampParser.parse(processed.getAlert().getTimestamp()).orElse(null)
        );
    }

    private record Ranked(ProcessedAlert alert, int rank, Instant time) {
    }
}
