package com.logsift.core.time;

/** Outcome of resolving a time expression: either the input was understood or the default was used. */
public sealed interface TimeResolution permits TimeResolution.Parsed, TimeResolution.FellBack {

    long epochSeconds();

    default boolean fellBack() {
        return this instanceof FellBack;
    }

    record Parsed(long epochSeconds, Form form) implements TimeResolution {}

    record FellBack(long epochSeconds) implements TimeResolution {}

    /** Which grammar produced a {@link Parsed} value. */
    enum Form {
        NUMERIC,
        SIMPLE_RELATIVE,
        RELATIVE_WITH_CLOCK_TIME,
        KEYWORD_WITH_CLOCK_TIME,
        ABSOLUTE,
        EPOCH_STRING
    }
}
