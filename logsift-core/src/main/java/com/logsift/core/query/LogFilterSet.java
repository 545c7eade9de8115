package com.logsift.core.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Independent filter dimensions for a log search.
 *
 * <p>{@code fields} keeps insertion order; that order is the order of the equality clauses in the
 * composed query.
 */
public record LogFilterSet(String query, String keyword, String pattern, Map<String, String> fields) {

    public static final String SERVICE = "service";
    public static final String HOST = "host";
    public static final String STATUS = "status";

    public LogFilterSet {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static LogFilterSet empty() {
        return new LogFilterSet(null, null, null, Map.of());
    }

    /** Create a new builder for {@link LogFilterSet}. */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String query;
        private String keyword;
        private String pattern;
        private final Map<String, String> fields = new LinkedHashMap<>();

        private Builder() {}

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder keyword(String keyword) {
            this.keyword = keyword;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder service(String service) {
            return field(SERVICE, service);
        }

        public Builder host(String host) {
            return field(HOST, host);
        }

        public Builder status(String status) {
            return field(STATUS, status);
        }

        public Builder field(String name, String value) {
            if (value != null) {
                fields.put(name, value);
            }
            return this;
        }

        public LogFilterSet build() {
            return new LogFilterSet(query, keyword, pattern, fields);
        }
    }
}
