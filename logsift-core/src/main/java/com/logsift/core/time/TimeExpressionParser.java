package com.logsift.core.time;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves loosely formatted time expressions to epoch seconds.
 *
 * Supported, tried in this order (first match wins):
 *  - 30s | 15m | 2h | 7d                      relative to now
 *  - 3d@11:45:23 | 3d@11:45 | 2h@15:00        relative with clock time ('@' or a space)
 *  - today@09:30 | yesterday 14:00:00         keyword with clock time, case-insensitive
 *  - 2024-01-15T11:45:23Z | 2024-01-15        absolute date-time
 *  - 1702656000                               epoch seconds as a string
 *
 * Anything else resolves to the caller's default. "Local" midnight is taken in the zone of the
 * injected {@link Clock}.
 *
 * <p>The hour form ({@code 2h@15:00}) only replaces minutes and seconds of {@code now - 2h}; the
 * hour given after the separator is ignored. Callers rely on this, so it is kept.
 */
public final class TimeExpressionParser {

    private static final Logger log = LoggerFactory.getLogger(TimeExpressionParser.class);

    private static final Pattern SIMPLE_RELATIVE = Pattern.compile("^(\\d+)([smhd])$");
    private static final Pattern RELATIVE_WITH_CLOCK_TIME =
            Pattern.compile("^(\\d+)([dh])[@\\s](\\d{1,2}):(\\d{2})(?::(\\d{2}))?$");
    private static final Pattern KEYWORD_WITH_CLOCK_TIME =
            Pattern.compile("^(today|yesterday)[@\\s](\\d{1,2}):(\\d{2})(?::(\\d{2}))?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern EPOCH_SECONDS = Pattern.compile("^[+-]?\\d+$");

    private static final DateTimeFormatter SPACED_LOCAL_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]");

    // Date-only input is UTC midnight; date-time input without an offset is local.
    private static final List<BiFunction<String, ZoneId, Instant>> ABSOLUTE_FORMS = List.of(
            (text, zone) -> OffsetDateTime.parse(text).toInstant(),
            (text, zone) -> ZonedDateTime.parse(text).toInstant(),
            (text, zone) -> LocalDateTime.parse(text).atZone(zone).toInstant(),
            (text, zone) ->
                    LocalDateTime.parse(text, SPACED_LOCAL_DATE_TIME).atZone(zone).toInstant(),
            (text, zone) -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant(),
            (text, zone) -> ZonedDateTime.parse(text, DateTimeFormatter.RFC_1123_DATE_TIME)
                    .toInstant());

    private final Clock clock;

    public TimeExpressionParser(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static long parse(Object input, long defaultValue, Clock clock) {
        return new TimeExpressionParser(clock).parse(input, defaultValue);
    }

    public long parse(Object input, long defaultValue) {
        return resolve(input, defaultValue).epochSeconds();
    }

    public TimeResolution resolve(Object input, long defaultValue) {
        if (input == null) {
            return new TimeResolution.FellBack(defaultValue);
        }
        if (input instanceof Number number) {
            return numeric(number, defaultValue);
        }
        if (!(input instanceof CharSequence)) {
            return new TimeResolution.FellBack(defaultValue);
        }

        String text = input.toString().trim();
        try {
            TimeResolution parsed = parseText(text);
            if (parsed != null) {
                return parsed;
            }
        } catch (ArithmeticException | DateTimeException | NumberFormatException e) {
            log.trace("Time expression '{}' is out of range: {}", text, e.getMessage());
        }
        return new TimeResolution.FellBack(defaultValue);
    }

    public long now() {
        return clock.instant().getEpochSecond();
    }

    public long hoursAgo(long hours) {
        return now() - hours * 3600L;
    }

    public long daysAgo(long days) {
        return now() - days * 86400L;
    }

    public Clock clock() {
        return clock;
    }

    private TimeResolution parseText(String text) {
        Matcher simple = SIMPLE_RELATIVE.matcher(text);
        if (simple.matches()) {
            long value = Long.parseLong(simple.group(1));
            long offset = Math.multiplyExact(value, unitSeconds(simple.group(2).charAt(0)));
            return parsed(Math.subtractExact(now(), offset), TimeResolution.Form.SIMPLE_RELATIVE);
        }

        Matcher relative = RELATIVE_WITH_CLOCK_TIME.matcher(text);
        if (relative.matches()) {
            long value = Long.parseLong(relative.group(1));
            int hours = Integer.parseInt(relative.group(3));
            int minutes = Integer.parseInt(relative.group(4));
            int seconds = seconds(relative.group(5));
            LocalDateTime at;
            if ("d".equals(relative.group(2))) {
                at = localMidnightDaysAgo(value).plusHours(hours).plusMinutes(minutes).plusSeconds(seconds);
            } else {
                at = LocalDateTime.now(clock)
                        .minusHours(value)
                        .truncatedTo(ChronoUnit.HOURS)
                        .plusMinutes(minutes)
                        .plusSeconds(seconds);
            }
            return parsed(toEpochSeconds(at), TimeResolution.Form.RELATIVE_WITH_CLOCK_TIME);
        }

        Matcher keyword = KEYWORD_WITH_CLOCK_TIME.matcher(text);
        if (keyword.matches()) {
            long daysAgo = "yesterday".equals(keyword.group(1).toLowerCase(Locale.ROOT)) ? 1 : 0;
            LocalDateTime at = localMidnightDaysAgo(daysAgo)
                    .plusHours(Integer.parseInt(keyword.group(2)))
                    .plusMinutes(Integer.parseInt(keyword.group(3)))
                    .plusSeconds(seconds(keyword.group(4)));
            return parsed(toEpochSeconds(at), TimeResolution.Form.KEYWORD_WITH_CLOCK_TIME);
        }

        Instant absolute = parseAbsolute(text);
        if (absolute != null) {
            return parsed(absolute.getEpochSecond(), TimeResolution.Form.ABSOLUTE);
        }

        if (EPOCH_SECONDS.matcher(text).matches()) {
            return parsed(Long.parseLong(text), TimeResolution.Form.EPOCH_STRING);
        }
        return null;
    }

    private Instant parseAbsolute(String text) {
        ZoneId zone = clock.getZone();
        for (BiFunction<String, ZoneId, Instant> form : ABSOLUTE_FORMS) {
            try {
                return form.apply(text, zone);
            } catch (DateTimeException notThisForm) {
                // try the next accepted shape
            }
        }
        return null;
    }

    private LocalDateTime localMidnightDaysAgo(long days) {
        return LocalDate.now(clock).minusDays(days).atStartOfDay();
    }

    private long toEpochSeconds(LocalDateTime localDateTime) {
        return localDateTime.atZone(clock.getZone()).toEpochSecond();
    }

    private static TimeResolution numeric(Number number, long defaultValue) {
        if (number instanceof Double || number instanceof Float) {
            double value = number.doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return new TimeResolution.FellBack(defaultValue);
            }
            return parsed((long) Math.floor(value), TimeResolution.Form.NUMERIC);
        }
        try {
            if (number instanceof BigDecimal decimal) {
                return parsed(decimal.setScale(0, RoundingMode.FLOOR).longValueExact(), TimeResolution.Form.NUMERIC);
            }
            if (number instanceof BigInteger integer) {
                return parsed(integer.longValueExact(), TimeResolution.Form.NUMERIC);
            }
        } catch (ArithmeticException e) {
            log.trace("Numeric time {} does not fit in epoch seconds", number);
            return new TimeResolution.FellBack(defaultValue);
        }
        return parsed(number.longValue(), TimeResolution.Form.NUMERIC);
    }

    private static TimeResolution parsed(long epochSeconds, TimeResolution.Form form) {
        return new TimeResolution.Parsed(epochSeconds, form);
    }

    private static int seconds(String group) {
        return group == null ? 0 : Integer.parseInt(group);
    }

    private static long unitSeconds(char unit) {
        return switch (unit) {
            case 's' -> 1L;
            case 'm' -> 60L;
            case 'h' -> 3600L;
            case 'd' -> 86400L;
            default -> throw new IllegalStateException("Unexpected relative unit: " + unit);
        };
    }
}
