package com.logsift.core.time;

/**
 * Turns a loosely supplied {@code (from, to)} pair into a usable range.
 *
 * <p>Reversed bounds are swapped and ranges narrower than the minimum span are widened by moving
 * {@code to}. Near {@link Long#MAX_VALUE} the range is pinned to the top and {@code from} moves
 * down instead. Never throws.
 */
public final class TimeRangeValidator {

    public static final long DEFAULT_MIN_SPAN_SECONDS = 60L;

    private TimeRangeValidator() {}

    public static TimeRange ensure(long from, long to) {
        return ensure(from, to, DEFAULT_MIN_SPAN_SECONDS);
    }

    public static TimeRange ensure(long from, long to, long minSpanSeconds) {
        long span = Math.max(1L, minSpanSeconds);
        if (from > to) {
            long swap = from;
            from = to;
            to = swap;
        }
        // a negative difference here means it overflowed, so the range is already wider than any span
        long difference = to - from;
        if (difference >= 0 && difference < span) {
            if (from > Long.MAX_VALUE - span) {
                from = Long.MAX_VALUE - span;
                to = Long.MAX_VALUE;
            } else {
                to = from + span;
            }
        }
        return new TimeRange(from, to);
    }
}
