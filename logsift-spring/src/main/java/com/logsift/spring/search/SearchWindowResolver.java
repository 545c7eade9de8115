package com.logsift.spring.search;

import com.logsift.core.time.TimeExpressionParser;
import com.logsift.core.time.TimeRange;
import com.logsift.core.time.TimeRangeValidator;
import com.logsift.core.time.TimeResolution;
import com.logsift.spring.autoconfigure.LogsiftProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns caller-supplied {@code from}/{@code to} expressions into a validated search window.
 *
 * <p>Absent bounds default to {@code now - defaultLookback} and {@code now}. Expressions that cannot
 * be read fall back to the same defaults and are logged here, since the core parser stays silent.
 */
@Slf4j
@RequiredArgsConstructor
public class SearchWindowResolver {

    private final TimeExpressionParser parser;
    private final LogsiftProperties properties;

    public TimeRange resolve(Object from, Object to) {
        long now = parser.now();
        long defaultFrom = now - properties.getTime().getDefaultLookback().toSeconds();

        TimeResolution start = parser.resolve(from, defaultFrom);
        TimeResolution end = parser.resolve(to, now);
        reportFallback("from", from, start);
        reportFallback("to", to, end);

        TimeRange range = TimeRangeValidator.ensure(
                start.epochSeconds(), end.epochSeconds(), properties.getTime().getMinSpanSeconds());
        if (range.from() != start.epochSeconds() || range.to() != end.epochSeconds()) {
            log.debug(
                    "Adjusted search window [{}, {}] to [{}, {}]",
                    start.epochSeconds(),
                    end.epochSeconds(),
                    range.from(),
                    range.to());
        }
        return range;
    }

    private static void reportFallback(String bound, Object input, TimeResolution resolution) {
        if (input != null && resolution.fellBack()) {
            log.debug(
                    "Unrecognised '{}' time expression '{}', using default {}",
                    bound,
                    input,
                    resolution.epochSeconds());
        }
    }
}
