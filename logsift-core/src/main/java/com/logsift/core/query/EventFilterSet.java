package com.logsift.core.query;

import java.util.List;
import java.util.Objects;

public record EventFilterSet(String query, List<String> sources, List<String> tags, String priority) {

    public EventFilterSet {
        sources = sources == null ? List.of() : sources.stream().filter(Objects::nonNull).toList();
        tags = tags == null ? List.of() : tags.stream().filter(Objects::nonNull).toList();
    }
}
