package com.logsift.core.pattern;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** One substitution step of a {@link PatternNormalizer}: every match of {@code regex} becomes {@code placeholder}. */
public record PatternRule(String name, Pattern regex, String placeholder) {

    public PatternRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(regex, "regex");
        Objects.requireNonNull(placeholder, "placeholder");
    }

    public static PatternRule of(String name, String regex, String placeholder) {
        return new PatternRule(name, Pattern.compile(regex), placeholder);
    }

    public static PatternRule ofIgnoringCase(String name, String regex, String placeholder) {
        return new PatternRule(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), placeholder);
    }

    public String apply(String text) {
        return regex.matcher(text).replaceAll(Matcher.quoteReplacement(placeholder));
    }
}
