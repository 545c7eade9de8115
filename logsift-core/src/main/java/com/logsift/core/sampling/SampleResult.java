package com.logsift.core.sampling;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Records chosen by a {@link Sampler}.
 *
 * @param mode the mode that produced this result
 * @param samples the selected records, in input order
 * @param fetched how many records the sampler was given
 * @param distinctPatterns distinct message patterns collected; {@code null} unless the mode was {@link SamplingMode#DIVERSE}
 */
public record SampleResult<T>(SamplingMode mode, List<T> samples, int fetched, Integer distinctPatterns) {

    public SampleResult {
        samples = Collections.unmodifiableList(new ArrayList<>(samples));
    }

    public int count() {
        return samples.size();
    }
}
