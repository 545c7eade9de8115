package com.logsift.spring.search;

import com.logsift.core.query.TraceFilterSet;

public record TraceSearchRequest(Object from, Object to, TraceFilterSet filters, Integer limit) {}
