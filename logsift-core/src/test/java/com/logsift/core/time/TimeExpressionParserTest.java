package com.logsift.core.time;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class TimeExpressionParserTest {

    private static final long NOW = 1_705_320_000L; // 2024-01-15T12:00:00Z
    private static final long DEFAULT = 42L;

    private final TimeExpressionParser parser =
            new TimeExpressionParser(Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC));

    @Test
    void absentInputReturnsDefault() {
        assertThat(parser.parse(null, DEFAULT)).isEqualTo(DEFAULT);
        assertThat(parser.resolve(null, DEFAULT).fellBack()).isTrue();
    }

    @Test
    void numericInputIsReturnedVerbatim() {
        assertThat(parser.parse(1_705_320_000L, DEFAULT)).isEqualTo(1_705_320_000L);
        assertThat(parser.parse(1_705_320_000, DEFAULT)).isEqualTo(1_705_320_000L);
        assertThat(parser.parse(1_705_320_000.9d, DEFAULT)).isEqualTo(1_705_320_000L);
        assertThat(parser.parse(new BigDecimal("-1.5"), DEFAULT)).isEqualTo(-2L);
        assertThat(parser.parse(Double.NaN, DEFAULT)).isEqualTo(DEFAULT);
    }

    @Test
    void numbersBeyondLongRangeFallBack() {
        BigInteger huge = BigInteger.valueOf(Long.MAX_VALUE).add(BigInteger.ONE);

        assertThat(parser.parse(huge, DEFAULT)).isEqualTo(DEFAULT);
        assertThat(parser.resolve(huge, DEFAULT).fellBack()).isTrue();
        assertThat(parser.parse(new BigDecimal(huge).negate().subtract(BigDecimal.ONE), DEFAULT)).isEqualTo(DEFAULT);
        assertThat(parser.parse(BigInteger.valueOf(Long.MAX_VALUE), DEFAULT)).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void numericMaximumStillYieldsAnOrderedRange() {
        long bound = parser.parse(Long.MAX_VALUE, 0);

        TimeRange range = TimeRangeValidator.ensure(bound, bound);

        assertThat(range.from()).isLessThan(range.to());
        assertThat(range.to()).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    void simpleRelativeSubtractsFromNow() {
        assertThat(parser.parse("30s", DEFAULT)).isEqualTo(NOW - 30);
        assertThat(parser.parse("15m", DEFAULT)).isEqualTo(NOW - 15 * 60);
        assertThat(parser.parse("2h", DEFAULT)).isEqualTo(NOW - 2 * 3600);
        assertThat(parser.parse("7d", DEFAULT)).isEqualTo(NOW - 7 * 86400);
        assertThat(parser.parse("0s", DEFAULT)).isEqualTo(NOW);
        assertThat(parser.parse("  2h  ", DEFAULT)).isEqualTo(NOW - 2 * 3600);
    }

    @Test
    void simpleRelativeIsExactForManyOffsets() {
        for (int value = 0; value < 500; value += 7) {
            assertThat(parser.parse(value + "s", DEFAULT)).isEqualTo(NOW - value);
            assertThat(parser.parse(value + "m", DEFAULT)).isEqualTo(NOW - value * 60L);
            assertThat(parser.parse(value + "h", DEFAULT)).isEqualTo(NOW - value * 3600L);
            assertThat(parser.parse(value + "d", DEFAULT)).isEqualTo(NOW - value * 86400L);
        }
    }

    @Test
    void dayRelativeWithClockTimeLandsOnMidnightOfThatDay() {
        long first = parser.parse("3d@11:45:23", DEFAULT);
        long second = parser.parse("3d@12:55:34", DEFAULT);

        assertThat(first).isEqualTo(1_705_059_923L); // 2024-01-12T11:45:23Z
        assertThat(second - first).isEqualTo(3600 + 10 * 60 + 11);
        long midnightThreeDaysAgo = 1_705_017_600L; // 2024-01-12T00:00:00Z
        assertThat(first - midnightThreeDaysAgo).isEqualTo(11 * 3600 + 45 * 60 + 23);
        assertThat(second - midnightThreeDaysAgo).isEqualTo(12 * 3600 + 55 * 60 + 34);
    }

    @Test
    void dayRelativeAcceptsSpaceSeparatorAndOptionalSeconds() {
        assertThat(parser.parse("1d 14:30", DEFAULT)).isEqualTo(1_705_242_600L); // 2024-01-14T14:30:00Z
        assertThat(parser.parse("1d@14:30:00", DEFAULT)).isEqualTo(1_705_242_600L);
    }

    @Test
    void dayRelativeRollsOverOutOfRangeClockFields() {
        assertThat(parser.parse("1d@25:00", DEFAULT)).isEqualTo(1_705_280_400L); // 2024-01-15T01:00:00Z
    }

    @Test
    void hourRelativeWithClockTimeKeepsShiftedHourAndReplacesMinutesAndSeconds() {
        // now - 2h = 10:00; only minute and second come from the expression
        assertThat(parser.parse("2h@15:30", DEFAULT)).isEqualTo(1_705_313_730L); // 10:15:30Z
        assertThat(parser.parse("2h@23:15:30", DEFAULT)).isEqualTo(1_705_313_730L);
        assertThat(parser.resolve("2h@23:15:30", DEFAULT))
                .isEqualTo(new TimeResolution.Parsed(1_705_313_730L, TimeResolution.Form.RELATIVE_WITH_CLOCK_TIME));
    }

    @Test
    void keywordsWithClockTime() {
        assertThat(parser.parse("today@09:30", DEFAULT)).isEqualTo(1_705_311_000L);
        assertThat(parser.parse("yesterday@14:00:00", DEFAULT)).isEqualTo(1_705_240_800L);
        assertThat(parser.parse("YESTERDAY 14:00", DEFAULT)).isEqualTo(1_705_240_800L);
        assertThat(parser.parse("Today@9:30", DEFAULT)).isEqualTo(1_705_311_000L);
    }

    @Test
    void localMidnightFollowsClockZone() {
        // 2024-01-15T12:00:00Z is 07:00 in New York
        TimeExpressionParser newYork =
                new TimeExpressionParser(Clock.fixed(Instant.ofEpochSecond(NOW), ZoneId.of("America/New_York")));
        assertThat(newYork.parse("yesterday@09:00", DEFAULT)).isEqualTo(1_705_240_800L); // 2024-01-14T14:00Z

        // 2024-01-16T03:00:00Z is still the 15th in New York
        TimeExpressionParser lateEvening = new TimeExpressionParser(
                Clock.fixed(Instant.parse("2024-01-16T03:00:00Z"), ZoneId.of("America/New_York")));
        assertThat(lateEvening.parse("today@20:39", DEFAULT)).isEqualTo(1_705_369_140L); // 2024-01-16T01:39Z
        assertThat(lateEvening.parse("0d@20:39", DEFAULT)).isEqualTo(1_705_369_140L);
    }

    @Test
    void absoluteTimestampsAreFlooredToSeconds() {
        assertThat(parser.parse("2024-01-15T11:45:23Z", DEFAULT)).isEqualTo(1_705_319_123L);
        assertThat(parser.parse("2024-01-15T11:45:23.999Z", DEFAULT)).isEqualTo(1_705_319_123L);
        assertThat(parser.parse("2024-01-15T12:45:23+01:00", DEFAULT)).isEqualTo(1_705_319_123L);
        assertThat(parser.parse("2024-01-15", DEFAULT)).isEqualTo(1_705_276_800L);
        assertThat(parser.parse("Mon, 15 Jan 2024 11:45:23 GMT", DEFAULT)).isEqualTo(1_705_319_123L);
        assertThat(parser.resolve("2024-01-15T11:45:23Z", DEFAULT))
                .isEqualTo(new TimeResolution.Parsed(1_705_319_123L, TimeResolution.Form.ABSOLUTE));
    }

    @Test
    void absoluteTimestampWithoutOffsetIsLocal() {
        TimeExpressionParser newYork =
                new TimeExpressionParser(Clock.fixed(Instant.ofEpochSecond(NOW), ZoneId.of("America/New_York")));
        assertThat(newYork.parse("2024-01-15T11:45:23", DEFAULT)).isEqualTo(1_705_337_123L);
        assertThat(newYork.parse("2024-01-15 11:45:23", DEFAULT)).isEqualTo(1_705_337_123L);
        assertThat(parser.parse("2024-01-15 11:45", DEFAULT)).isEqualTo(1_705_319_100L);
    }

    @Test
    void epochSecondsAsString() {
        assertThat(parser.parse("1705320000", DEFAULT)).isEqualTo(1_705_320_000L);
        assertThat(parser.resolve(" 1705320000 ", DEFAULT))
                .isEqualTo(new TimeResolution.Parsed(1_705_320_000L, TimeResolution.Form.EPOCH_STRING));
    }

    @Test
    void unrecognisedInputFallsBackToDefault() {
        assertThat(parser.parse("", DEFAULT)).isEqualTo(DEFAULT);
        assertThat(parser.parse("last tuesday", DEFAULT)).isEqualTo(DEFAULT);
        assertThat(parser.parse("5 minutes ago", DEFAULT)).isEqualTo(DEFAULT);
        assertThat(parser.parse("3w", DEFAULT)).isEqualTo(DEFAULT);
        assertThat(parser.parse("3d@1145", DEFAULT)).isEqualTo(DEFAULT);
        assertThat(parser.parse(new Object(), DEFAULT)).isEqualTo(DEFAULT);
        assertThat(parser.resolve("soon", DEFAULT)).isEqualTo(new TimeResolution.FellBack(DEFAULT));
    }

    @Test
    void overflowingValuesFallBackToDefault() {
        assertThat(parser.parse("99999999999999999999d", DEFAULT)).isEqualTo(DEFAULT);
        assertThat(parser.parse("999999999999999d", DEFAULT)).isEqualTo(DEFAULT);
        assertThat(parser.parse("99999999999999999999", DEFAULT)).isEqualTo(DEFAULT);
        assertThat(parser.parse("999999999999999d@10:00", DEFAULT)).isEqualTo(DEFAULT);
    }

    @Test
    void helpersReadTheInjectedClock() {
        assertThat(parser.now()).isEqualTo(NOW);
        assertThat(parser.hoursAgo(2)).isEqualTo(NOW - 7200);
        assertThat(parser.daysAgo(1)).isEqualTo(NOW - 86400);
        assertThat(TimeExpressionParser.parse("1m", DEFAULT, parser.clock())).isEqualTo(NOW - 60);
    }
}
