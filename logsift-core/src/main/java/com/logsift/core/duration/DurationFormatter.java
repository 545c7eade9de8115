package com.logsift.core.duration;

import java.util.Locale;

/** Renders nanoseconds with the largest unit that keeps the number readable: 950ns, 12.5ms, 1.25s, 3.10m. */
public final class DurationFormatter {

    private DurationFormatter() {}

    public static String format(long nanos) {
        if (nanos < 1_000L) {
            return nanos + "ns";
        }
        if (nanos < 1_000_000L) {
            return String.format(Locale.ROOT, "%.1fµs", nanos / 1_000d);
        }
        if (nanos < 1_000_000_000L) {
            return String.format(Locale.ROOT, "%.1fms", nanos / 1_000_000d);
        }
        if (nanos < 60_000_000_000L) {
            return String.format(Locale.ROOT, "%.2fs", nanos / 1_000_000_000d);
        }
        return String.format(Locale.ROOT, "%.2fm", nanos / 60_000_000_000d);
    }
}
