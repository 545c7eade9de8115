package com.logsift.spring.search;

import com.logsift.core.sampling.SamplingMode;
import com.logsift.core.time.TimeRange;

/**
 * What the search client should ask for: the composed query, the window, and how many raw records
 * to fetch so that {@code mode} can still return {@code limit} representative ones.
 */
public record LogSearchPlan(String query, TimeRange window, SamplingMode mode, int limit, int fetchLimit) {}
