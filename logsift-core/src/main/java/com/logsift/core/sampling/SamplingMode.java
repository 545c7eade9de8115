package com.logsift.core.sampling;

import java.util.Locale;

/**
 * How a {@link Sampler} picks records.
 */
public enum SamplingMode {
    /** Chronological truncation. */
    FIRST("first"),
    /** Evenly spaced indices across the fetched records. */
    SPREAD("spread"),
    /** One exemplar per distinct message pattern. */
    DIVERSE("diverse");

    private final String value;

    SamplingMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /** Whether the caller should fetch more than the requested limit before sampling. */
    public boolean overFetches() {
        return this != FIRST;
    }

    /**
     * Number of raw records to fetch for a requested sample size, capped at {@code maxFetch}.
     */
    public int fetchSize(int limit, int overFetchFactor, int maxFetch) {
        long wanted = overFetches() ? (long) limit * Math.max(1, overFetchFactor) : limit;
        return (int) Math.max(0L, Math.min(wanted, maxFetch));
    }

    /** Lenient lookup: null, blank and unknown values mean {@link #FIRST}. */
    public static SamplingMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return FIRST;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "spread" -> SPREAD;
            case "diverse" -> DIVERSE;
            default -> FIRST;
        };
    }
}
