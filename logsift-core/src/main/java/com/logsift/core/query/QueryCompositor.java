package com.logsift.core.query;

import com.logsift.core.duration.DurationParser;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalLong;
import java.util.stream.Collectors;

/**
 * Merges independently supplied filter dimensions into a single search query string.
 *
 * Log clause order:
 *  - base query, verbatim
 *  - keyword as an exact phrase: "connection reset"
 *  - regex on the message: @message:~"ERROR.*timeout"
 *  - field equalities in declared order: service:web host:db-1 status:error
 *
 * Absent or empty dimensions contribute nothing; with no dimension at all the query is {@code *}.
 */
public final class QueryCompositor {

    static final String MESSAGE_FIELD = "@message";
    static final String HTTP_STATUS_FIELD = "@http.status_code";

    private QueryCompositor() {}

    public static String build(LogFilterSet filters) {
        if (filters == null) {
            return QueryClauses.MATCH_ALL;
        }
        QueryClauses clauses = new QueryClauses()
                .raw(filters.query())
                .phrase(filters.keyword())
                .regex(MESSAGE_FIELD, filters.pattern());
        for (Map.Entry<String, String> field : filters.fields().entrySet()) {
            clauses.equality(field.getKey(), field.getValue());
        }
        return clauses.build();
    }

    public static String build(TraceFilterSet filters) {
        if (filters == null) {
            return QueryClauses.MATCH_ALL;
        }
        QueryClauses clauses = new QueryClauses()
                .raw(filters.query())
                .equality("service", filters.service())
                .equality("operation_name", filters.operation())
                .equality("resource_name", filters.resource())
                .equality("status", filters.status())
                .equality("env", filters.env())
                .raw(durationClause(">=", filters.minDuration()))
                .raw(durationClause("<=", filters.maxDuration()));
        if (QueryClauses.isPresent(filters.httpStatus())) {
            clauses.raw(httpStatusClause(filters.httpStatus()));
        }
        return clauses.wildcard("error.type", filters.errorType())
                .wildcard("error.message", filters.errorMessage())
                .build();
    }

    public static String build(EventFilterSet filters) {
        if (filters == null) {
            return QueryClauses.MATCH_ALL;
        }
        QueryClauses clauses = new QueryClauses().raw(filters.query());
        if (!filters.sources().isEmpty()) {
            clauses.raw(filters.sources().stream()
                    .map(source -> "source:" + source)
                    .collect(Collectors.joining(" OR ", "(", ")")));
        }
        filters.tags().forEach(clauses::raw);
        return clauses.equality("priority", filters.priority()).build();
    }

    /** Unparseable durations drop the clause rather than failing the whole query. */
    static String durationClause(String comparator, String duration) {
        if (!QueryClauses.isPresent(duration)) {
            return null;
        }
        OptionalLong nanos = DurationParser.parse(duration);
        return nanos.isPresent() ? "@duration:" + comparator + nanos.getAsLong() : null;
    }

    /** Accepts a class ("5xx"), a comparison (">=500", "<400") or an exact code ("404"). */
    static String httpStatusClause(String httpStatus) {
        String status = httpStatus.toLowerCase(Locale.ROOT);
        if (status.endsWith("xx") && Character.isDigit(status.charAt(0))) {
            int base = Character.digit(status.charAt(0), 10) * 100;
            return HTTP_STATUS_FIELD + ":[" + base + " TO " + (base + 99) + "]";
        }
        for (String comparator : new String[] {">=", "<=", ">", "<"}) {
            if (status.startsWith(comparator)) {
                return HTTP_STATUS_FIELD + ":" + comparator + status.substring(comparator.length());
            }
        }
        return HTTP_STATUS_FIELD + ":" + httpStatus;
    }
}
