package com.logsift.core.sampling;

import com.logsift.core.pattern.PatternNormalizer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reduces an already fetched list of records to at most {@code limit} of them.
 *
 * <p>The sampler never fetches anything. For {@link SamplingMode#SPREAD} and
 * {@link SamplingMode#DIVERSE} to cover more than {@code limit} records the caller has to over-fetch
 * first (see {@link SamplingMode#fetchSize(int, int, int)}).
 */
public final class Sampler {

    private static final Logger log = LoggerFactory.getLogger(Sampler.class);

    private final PatternNormalizer normalizer;

    public Sampler(PatternNormalizer normalizer) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    }

    public Sampler() {
        this(PatternNormalizer.defaults());
    }

    public <T extends LogRecord> SampleResult<T> select(List<T> records, int limit, SamplingMode mode) {
        return select(records, limit, mode, LogRecord::message);
    }

    public <T> SampleResult<T> select(
            List<T> records, int limit, SamplingMode mode, Function<? super T, String> messageOf) {
        SamplingMode effective = mode != null ? mode : SamplingMode.FIRST;
        List<T> input = records != null ? records : List.of();

        SampleResult<T> result = switch (effective) {
            case FIRST -> new SampleResult<>(effective, first(input, limit), input.size(), null);
            case SPREAD -> new SampleResult<>(effective, spread(input, limit), input.size(), null);
            case DIVERSE -> diverse(input, limit, messageOf);
        };
        if (log.isDebugEnabled()) {
            log.debug(
                    "Sampled {} of {} records (mode={}, limit={}, distinctPatterns={})",
                    result.count(),
                    result.fetched(),
                    effective.value(),
                    limit,
                    result.distinctPatterns());
        }
        return result;
    }

    static <T> List<T> first(List<T> records, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return records.subList(0, Math.min(limit, records.size()));
    }

    /** Picks {@code floor(i * size / limit)} for each {@code i < limit}; index 0 is always included. */
    static <T> List<T> spread(List<T> records, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        int size = records.size();
        if (size <= limit) {
            return records;
        }
        List<T> picked = new ArrayList<>(limit);
        for (int i = 0; i < limit; i++) {
            picked.add(records.get((int) ((long) i * size / limit)));
        }
        return picked;
    }

    <T> SampleResult<T> diverse(List<T> records, int limit, Function<? super T, String> messageOf) {
        Map<String, T> firstByPattern = new LinkedHashMap<>();
        if (limit > 0) {
            for (T record : records) {
                String message = record != null ? messageOf.apply(record) : null;
                String pattern = normalizer.normalize(message);
                if (!firstByPattern.containsKey(pattern)) {
                    firstByPattern.put(pattern, record);
                    if (firstByPattern.size() >= limit) {
                        break;
                    }
                }
            }
        }
        return new SampleResult<>(
                SamplingMode.DIVERSE, new ArrayList<>(firstByPattern.values()), records.size(), firstByPattern.size());
    }
}
