package com.logsift.core.time;

import java.time.Instant;

/** Closed-open range of epoch seconds; {@link TimeRangeValidator} guarantees {@code from < to}. */
public record TimeRange(long from, long to) {

    /** Saturates at {@link Long#MAX_VALUE} for ranges wider than a {@code long} can hold. */
    public long spanSeconds() {
        long span = to - from;
        return span < 0 && from < to ? Long.MAX_VALUE : span;
    }

    public Instant fromInstant() {
        return Instant.ofEpochSecond(from);
    }

    public Instant toInstant() {
        return Instant.ofEpochSecond(to);
    }
}
