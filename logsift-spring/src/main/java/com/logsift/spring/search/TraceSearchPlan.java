package com.logsift.spring.search;

import com.logsift.core.time.TimeRange;

public record TraceSearchPlan(String query, TimeRange window, int limit) {}
