package com.logsift.core.pattern;

import java.util.List;

/**
 * Maps a log message to a canonical pattern by replacing variable parts with placeholders, so that
 * "user 42a1b3c4d5e6f708 timed out after 3000ms" and "user 99ffee00aa11bb22 timed out after 3000ms"
 * share one key.
 *
 * <p>Rules run in table order over the whole message; each rule sees the output of the previous
 * one. The default table replaces UUIDs before hex runs and hex runs before plain numbers, so a
 * later rule never re-matches text an earlier one already substituted. The result is cut to
 * {@link #maxLength()} characters.
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public final class PatternNormalizer {

    public static final int DEFAULT_MAX_LENGTH = 200;

    // ASCII word boundaries; \b on JDK 17 also counts accented letters as word characters
    private static final String START = "(?<![A-Za-z0-9_])";
    private static final String END = "(?![A-Za-z0-9_])";

    public static final List<PatternRule> DEFAULT_RULES = List.of(
            PatternRule.ofIgnoringCase(
                    "uuid", "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}", "{UUID}"),
            PatternRule.ofIgnoringCase("long-hex", START + "[0-9a-f]{16,}" + END, "{HEX}"),
            PatternRule.ofIgnoringCase("short-hex", START + "[0-9a-f]{8,15}" + END, "{ID}"),
            PatternRule.of("iso-timestamp", "\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}[.\\dZ]*", "{TS}"),
            PatternRule.of("ipv4", START + "\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}" + END, "{IP}"),
            PatternRule.of("number", START + "\\d{4,}" + END, "{N}"));

    private static final PatternNormalizer DEFAULT = new PatternNormalizer(DEFAULT_RULES, DEFAULT_MAX_LENGTH);

    private final List<PatternRule> rules;
    private final int maxLength;

    public PatternNormalizer(List<PatternRule> rules, int maxLength) {
        if (maxLength <= 0) {
            throw new IllegalArgumentException("maxLength must be positive: " + maxLength);
        }
        this.rules = List.copyOf(rules);
        this.maxLength = maxLength;
    }

    public static PatternNormalizer defaults() {
        return DEFAULT;
    }

    public static PatternNormalizer withMaxLength(int maxLength) {
        return new PatternNormalizer(DEFAULT_RULES, maxLength);
    }

    public String normalize(String message) {
        if (message == null || message.isEmpty()) {
            return "";
        }
        String pattern = message;
        for (PatternRule rule : rules) {
            pattern = rule.apply(pattern);
        }
        return pattern.length() > maxLength ? pattern.substring(0, maxLength) : pattern;
    }

    public List<PatternRule> rules() {
        return rules;
    }

    public int maxLength() {
        return maxLength;
    }
}
