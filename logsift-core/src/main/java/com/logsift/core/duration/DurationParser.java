package com.logsift.core.duration;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility to parse simplified duration strings like "500ms" or "1.5s" into nanoseconds.
 *
 * <p>A missing unit means nanoseconds. Unparseable input yields an empty result, which callers read
 * as "no duration filter requested".
 */
public final class DurationParser {

    private static final Pattern SHORTHAND = Pattern.compile("^(\\d+(?:\\.\\d+)?)(ns|µs|us|ms|s|m|h|d|w)?$");
    private static final Pattern BARE_INTEGER = Pattern.compile("^\\+?\\d+$");

    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

    private static final Map<String, BigDecimal> NANOS_PER_UNIT = Map.of(
            "ns", BigDecimal.ONE,
            "µs", BigDecimal.valueOf(1_000L),
            "us", BigDecimal.valueOf(1_000L),
            "ms", BigDecimal.valueOf(1_000_000L),
            "s", BigDecimal.valueOf(1_000_000_000L),
            "m", BigDecimal.valueOf(60_000_000_000L),
            "h", BigDecimal.valueOf(3_600_000_000_000L),
            "d", BigDecimal.valueOf(86_400_000_000_000L),
            "w", BigDecimal.valueOf(604_800_000_000_000L));

    private DurationParser() {}

    public static OptionalLong parse(Object input) {
        if (input == null) {
            return OptionalLong.empty();
        }
        if (input instanceof Number number) {
            return fromNumber(number);
        }
        return parse(input.toString());
    }

    public static OptionalLong parse(String input) {
        if (input == null) {
            return OptionalLong.empty();
        }

        String lower = input.trim().toLowerCase(Locale.ROOT);
        Matcher matcher = SHORTHAND.matcher(lower);
        if (matcher.matches()) {
            String unit = matcher.group(2) != null ? matcher.group(2) : "ns";
            BigDecimal nanos = new BigDecimal(matcher.group(1)).multiply(NANOS_PER_UNIT.get(unit));
            return floorToLong(nanos);
        }

        if (BARE_INTEGER.matcher(lower).matches()) {
            try {
                return OptionalLong.of(Long.parseLong(lower));
            } catch (NumberFormatException overflow) {
                return OptionalLong.empty();
            }
        }
        return OptionalLong.empty();
    }

    private static OptionalLong fromNumber(Number number) {
        if (number instanceof Double || number instanceof Float) {
            double value = number.doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return OptionalLong.empty();
            }
            return floorToLong(BigDecimal.valueOf(value));
        }
        if (number instanceof BigDecimal decimal) {
            return floorToLong(decimal);
        }
        long value = number.longValue();
        return value < 0 ? OptionalLong.empty() : OptionalLong.of(value);
    }

    private static OptionalLong floorToLong(BigDecimal nanos) {
        BigDecimal floored = nanos.setScale(0, RoundingMode.FLOOR);
        if (floored.signum() < 0 || floored.compareTo(LONG_MAX) > 0) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(floored.longValueExact());
    }
}
