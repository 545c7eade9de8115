package com.logsift.core.query;

/**
 * Filter dimensions for an APM span search. Durations are human strings ("500ms", "2s") and are
 * converted to nanoseconds when the query is composed.
 */
public record TraceFilterSet(
        String query,
        String service,
        String operation,
        String resource,
        String status,
        String env,
        String minDuration,
        String maxDuration,
        String httpStatus,
        String errorType,
        String errorMessage) {

    /** Create a new builder for {@link TraceFilterSet}. */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String query;
        private String service;
        private String operation;
        private String resource;
        private String status;
        private String env;
        private String minDuration;
        private String maxDuration;
        private String httpStatus;
        private String errorType;
        private String errorMessage;

        private Builder() {}

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder service(String service) {
            this.service = service;
            return this;
        }

        public Builder operation(String operation) {
            this.operation = operation;
            return this;
        }

        public Builder resource(String resource) {
            this.resource = resource;
            return this;
        }

        public Builder status(String status) {
            this.status = status;
            return this;
        }

        public Builder env(String env) {
            this.env = env;
            return this;
        }

        public Builder minDuration(String minDuration) {
            this.minDuration = minDuration;
            return this;
        }

        public Builder maxDuration(String maxDuration) {
            this.maxDuration = maxDuration;
            return this;
        }

        public Builder httpStatus(String httpStatus) {
            this.httpStatus = httpStatus;
            return this;
        }

        public Builder errorType(String errorType) {
            this.errorType = errorType;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public TraceFilterSet build() {
            return new TraceFilterSet(
                    query,
                    service,
                    operation,
                    resource,
                    status,
                    env,
                    minDuration,
                    maxDuration,
                    httpStatus,
                    errorType,
                    errorMessage);
        }
    }
}
