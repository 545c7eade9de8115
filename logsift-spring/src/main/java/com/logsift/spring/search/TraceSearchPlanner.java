package com.logsift.spring.search;

import com.logsift.core.query.QueryCompositor;
import com.logsift.core.time.TimeRange;
import com.logsift.spring.autoconfigure.LogsiftProperties;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Span searches are not sampled; the limit is only capped at {@code logsift.sampling.max-fetch}. */
@Slf4j
@RequiredArgsConstructor
public class TraceSearchPlanner {

    private final SearchWindowResolver windowResolver;
    private final LogsiftProperties properties;

    public TraceSearchPlan plan(TraceSearchRequest request) {
        Objects.requireNonNull(request, "trace search request");

        TimeRange window = windowResolver.resolve(request.from(), request.to());
        String query = QueryCompositor.build(request.filters());

        LogsiftProperties.Sampling sampling = properties.getSampling();
        int requested = request.limit() != null && request.limit() > 0 ? request.limit() : sampling.getDefaultLimit();
        int limit = Math.min(requested, sampling.getMaxFetch());

        log.debug("Planned trace search query='{}' window={} limit={}", query, window, limit);
        return new TraceSearchPlan(query, window, limit);
    }
}
