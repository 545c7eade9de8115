package com.logsift.spring.search;

/**
 * Raw log search parameters as an automated caller supplies them.
 *
 * <p>{@code from} and {@code to} may be strings, epoch-second numbers or {@code null}; {@code sample}
 * is "first", "spread" or "diverse".
 */
public record LogSearchRequest(
        Object from,
        Object to,
        String query,
        String keyword,
        String pattern,
        String service,
        String host,
        String status,
        Integer limit,
        String sample) {

    /** Create a new builder for {@link LogSearchRequest}. */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Object from;
        private Object to;
        private String query;
        private String keyword;
        private String pattern;
        private String service;
        private String host;
        private String status;
        private Integer limit;
        private String sample;

        private Builder() {}

        public Builder from(Object from) {
            this.from = from;
            return this;
        }

        public Builder to(Object to) {
            this.to = to;
            return this;
        }

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
            this.service = service;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder sample(String sample) {
            this.sample = sample;
            return this;
        }

        public LogSearchRequest build() {
            return new LogSearchRequest(from, to, query, keyword, pattern, service, host, status, limit, sample);
        }
    }
}
