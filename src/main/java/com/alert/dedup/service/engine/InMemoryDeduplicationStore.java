package com.alert.dedup.service.engine;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory implementation of DeduplicationStore.
 *
 * Thread-safe using ConcurrentHashMap; the check-and-update for a
 * fingerprint runs inside a single {@code compute} call.
 */
@Slf4j
public class InMemoryDeduplicationStore implements DeduplicationStore {

    private final Map<String, Instant> lastSeen = new ConcurrentHashMap<>();

    @Override
    public boolean recordIfNovel(String fingerprint, Instant alertTime, Duration window) {
        AtomicBoolean novel = new AtomicBoolean(false);

        lastSeen.compute(fingerprint, (key, stored) -> {
            if (stored != null && withinWindow(stored, alertTime, window)) {
                return stored;
            }
            novel.set(true);
            return alertTime;
        });
        return novel.get();
    }

    @Override
    public Optional<Instant> lastSeen(String fingerprint) {
        return Optional.ofNullable(lastSeen.get(fingerprint));
    }

    @Override
    public void clear() {
        lastSeen.clear();
        log.info("Cleared all deduplication state");
    }

    @Override
    public int size() {
        return lastSeen.size();
    }

    // Elapsed time is truncated to whole seconds before the comparison.
    private static boolean withinWindow(Instant stored, Instant alertTime, Duration window) {
        long elapsedSeconds = Duration.between(stored, alertTime).abs().getSeconds();
        return elapsedSeconds < window.getSeconds();
    }
}
