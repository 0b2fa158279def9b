package com.smurthy.ai.search.domain;

import java.util.List;
import java.util.Map;

/**
 * Validated search request.
 *
 * Instances are only produced by the request validator, so every field is
 * already within bounds. {@code model}, {@code searchMode} and
 * {@code dateRange} are {@code null} when the caller left them out.
 */
public record SearchRequest(
        String query,
        SearchModel model,
        SearchMode searchMode,
        DateRange dateRange,
        int maxTokens,
        List<String> sources,
        Map<String, String> options
) {

    public static final int MAX_QUERY_LENGTH = 10_000;
    public static final int MAX_TOKENS = 128_000;
    public static final int MAX_SOURCES_COUNT = 10;
    public static final int MAX_OPTIONS_COUNT = 20;
    public static final int MAX_OPTION_KEY_LENGTH = 100;
    public static final int MAX_OPTION_VALUE_LENGTH = 1_000;

    public SearchRequest {
        sources = sources == null ? List.of() : List.copyOf(sources);
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    public static SearchRequest of(String query) {
        return new SearchRequest(query, null, null, null, 0, List.of(), Map.of());
    }

    public boolean hasModel() {
        return model != null;
    }

    public SearchRequest withModel(SearchModel newModel) {
        return new SearchRequest(query, newModel, searchMode, dateRange, maxTokens, sources, options);
    }
}
