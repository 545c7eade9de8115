package com.logsift.spring.autoconfigure;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for time resolution and log sampling.
 *
 * <h3>Configuration Example:</h3>
 * <pre>{@code
 * # application.yml
 * logsift:
 *   enabled: true
 *   time:
 *     min-span-seconds: 60     # narrowest search window
 *     default-lookback: 24h    # window start when "from" is absent or unreadable
 *   sampling:
 *     default-limit: 25
 *     max-fetch: 100           # upper bound on records fetched before sampling
 *     over-fetch-factor: 4     # spread/diverse fetch limit * factor
 *   pattern:
 *     max-length: 200
 * }</pre>
 */
@Validated
@ConfigurationProperties(prefix = "logsift")
public class LogsiftProperties {

    /** Master switch for the auto-configuration. */
    private boolean enabled = true;

    @Valid
    private final Time time = new Time();

    @Valid
    private final Sampling sampling = new Sampling();

    @Valid
    private final Patterns pattern = new Patterns();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Time getTime() {
        return time;
    }

    public Sampling getSampling() {
        return sampling;
    }

    public Patterns getPattern() {
        return pattern;
    }

    public static class Time {

        @Min(1)
        private long minSpanSeconds = 60;

        @NotNull
        private Duration defaultLookback = Duration.ofHours(24);

        public long getMinSpanSeconds() {
            return minSpanSeconds;
        }

        public void setMinSpanSeconds(long minSpanSeconds) {
            this.minSpanSeconds = minSpanSeconds;
        }

        public Duration getDefaultLookback() {
            return defaultLookback;
        }

        public void setDefaultLookback(Duration defaultLookback) {
            this.defaultLookback = defaultLookback;
        }
    }

    public static class Sampling {

        @Min(1)
        private int defaultLimit = 25;

        @Min(1)
        private int maxFetch = 100;

        @Min(1)
        private int overFetchFactor = 4;

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public int getMaxFetch() {
            return maxFetch;
        }

        public void setMaxFetch(int maxFetch) {
            this.maxFetch = maxFetch;
        }

        public int getOverFetchFactor() {
            return overFetchFactor;
        }

        public void setOverFetchFactor(int overFetchFactor) {
            this.overFetchFactor = overFetchFactor;
        }
    }

    public static class Patterns {

        /** Patterns are cut to this many characters before they are compared. */
        @Min(1)
        private int maxLength = 200;

        public int getMaxLength() {
            return maxLength;
        }

        public void setMaxLength(int maxLength) {
            this.maxLength = maxLength;
        }
    }
}
