package com.auditsift.core.model;

import java.util.List;
import java.util.Objects;

/** 검색 규칙 1개와 그 규칙이 만든 결과(시스템 순서 유지). */
public record SearchResults(SearchConfig config, List<SearchResult> results) {

    public SearchResults {
        Objects.requireNonNull(config, "config");
        results = (results == null) ? List.of() : List.copyOf(results);
    }

    public int count() { return results.size(); }

    public boolean isEmpty() { return results.isEmpty(); }
}
