package com.logsift.core.query;

import java.util.ArrayList;
import java.util.List;

/** Accumulates query clauses, skipping absent values, and joins them with single spaces. */
final class QueryClauses {

    static final String MATCH_ALL = "*";

    private final List<String> clauses = new ArrayList<>();

    QueryClauses raw(String clause) {
        if (isPresent(clause)) {
            clauses.add(clause);
        }
        return this;
    }

    QueryClauses phrase(String value) {
        if (isPresent(value)) {
            clauses.add('"' + escapeQuotes(value) + '"');
        }
        return this;
    }

    QueryClauses regex(String field, String value) {
        if (isPresent(value)) {
            clauses.add(field + ":~\"" + escapeQuotes(value) + '"');
        }
        return this;
    }

    /** Field values are emitted verbatim; they are expected to be single tokens already. */
    QueryClauses equality(String field, String value) {
        if (isPresent(value)) {
            clauses.add(field + ':' + value);
        }
        return this;
    }

    QueryClauses wildcard(String field, String value) {
        if (isPresent(value)) {
            clauses.add(field + ":*" + escapeQuotes(value) + '*');
        }
        return this;
    }

    String build() {
        return clauses.isEmpty() ? MATCH_ALL : String.join(" ", clauses);
    }

    static boolean isPresent(String value) {
        return value != null && !value.isEmpty();
    }

    static String escapeQuotes(String value) {
        return value.replace("\"", "\\\"");
    }
}
