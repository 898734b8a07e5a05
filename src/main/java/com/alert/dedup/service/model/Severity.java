package com.alert.dedup.service.model;

/**
 * Alert severity levels with their prioritization rank.
 *
 * Alerts carry severity as a raw string, so values outside this enum are
 * legal and rank below {@link #LOW}.
 */
public enum Severity {

    CRITICAL(4),
    HIGH(3),
    MEDIUM(2),
    LOW(1);

    public static final int UNKNOWN_RANK = 0;

    private final int rank;

    Severity(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    /**
     * Rank of a raw severity string. Matching is case-sensitive.
     *
     * @param severity the raw severity, may be null
     * @return the rank, or {@link #UNKNOWN_RANK} for unrecognized values
     */
    public static int rankOf(String severity) {
        if (severity == null) {
            return UNKNOWN_RANK;
        }
        for (Severity value : values()) {
            if (value.name().equals(severity)) {
                return value.rank;
            }
        }
        return UNKNOWN_RANK;
    }
}
