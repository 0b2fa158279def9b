package com.smurthy.ai.search.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Search outcome mapped from a successful upstream response.
 * Citation and source lists keep upstream order and are empty, never null,
 * when the upstream omitted them.
 */
public record SearchResult(
        String id,
        String content,
        String model,
        Usage usage,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<Citation> citations,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) List<Source> sources,
        Instant created
) {
    public SearchResult {
        citations = citations == null ? List.of() : List.copyOf(citations);
        sources = sources == null ? List.of() : List.copyOf(sources);
        usage = usage == null ? Usage.EMPTY : usage;
    }
}
