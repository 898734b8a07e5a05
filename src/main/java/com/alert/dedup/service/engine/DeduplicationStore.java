package com.alert.dedup.service.engine;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Interface for the fingerprint store backing deduplication.
 *
 * Maps each fingerprint to the time of the last accepted alert bearing it.
 * Implementations must make {@link #recordIfNovel} atomic per fingerprint;
 * an external key-value store would use compare-and-swap with a TTL equal
 * to the window.
 */
public interface DeduplicationStore {

    /**
     * Classifies an alert time against the stored time for its fingerprint.
     *
     * Novel when no time is stored or when the two times are at least
     * {@code window} whole seconds apart in either direction. A novel time
     * always replaces the stored one, even when it is older.
     *
     * @param fingerprint the alert fingerprint
     * @param alertTime the alert time
     * @param window the deduplication window
     * @return true if the alert is novel and was recorded, false for a duplicate
     */
    boolean recordIfNovel(String fingerprint, Instant alertTime, Duration window);

    /**
     * Gets the time of the last accepted alert for a fingerprint.
     *
     * @param fingerprint the alert fingerprint
     * @return the stored time if present
     */
    Optional<Instant> lastSeen(String fingerprint);

    /**
     * Clears all stored fingerprints.
     */
    void clear();

    /**
     * Gets the number of tracked fingerprints.
     *
     * @return count of fingerprints
     */
    int size();
}
