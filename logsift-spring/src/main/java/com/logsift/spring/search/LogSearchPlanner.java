package com.logsift.spring.search;

import com.logsift.core.query.LogFilterSet;
import com.logsift.core.query.QueryCompositor;
import com.logsift.core.sampling.LogRecord;
import com.logsift.core.sampling.SampleResult;
import com.logsift.core.sampling.Sampler;
import com.logsift.core.sampling.SamplingMode;
import com.logsift.core.time.TimeRange;
import com.logsift.spring.autoconfigure.LogsiftProperties;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class LogSearchPlanner {

    private final SearchWindowResolver windowResolver;
    private final Sampler sampler;
    private final LogsiftProperties properties;

    public LogSearchPlan plan(LogSearchRequest request) {
        Objects.requireNonNull(request, "log search request");

        TimeRange window = windowResolver.resolve(request.from(), request.to());
        String query = QueryCompositor.build(LogFilterSet.builder()
                .query(request.query())
                .keyword(request.keyword())
                .pattern(request.pattern())
                .service(request.service())
                .host(request.host())
                .status(request.status())
                .build());

        LogsiftProperties.Sampling sampling = properties.getSampling();
        SamplingMode mode = SamplingMode.fromValue(request.sample());
        int limit = request.limit() != null && request.limit() > 0 ? request.limit() : sampling.getDefaultLimit();
        int fetchLimit = mode.fetchSize(limit, sampling.getOverFetchFactor(), sampling.getMaxFetch());

        log.debug(
                "Planned log search query='{}' window={} mode={} limit={} fetch={}",
                query,
                window,
                mode.value(),
                limit,
                fetchLimit);
        return new LogSearchPlan(query, window, mode, limit, fetchLimit);
    }

    public <T extends LogRecord> SampleResult<T> sample(LogSearchPlan plan, List<T> fetched) {
        return sampler.select(fetched, plan.limit(), plan.mode());
    }

    public <T> SampleResult<T> sample(LogSearchPlan plan, List<T> fetched, Function<? super T, String> messageOf) {
        return sampler.select(fetched, plan.limit(), plan.mode(), messageOf);
    }
}
