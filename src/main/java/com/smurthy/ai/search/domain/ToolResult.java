package com.smurthy.ai.search.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalized execution outcome handed to the protocol layer, whatever
 * capability produced it.
 */
public record ToolResult(
        String content,
        boolean isError,
        Map<String, Object> metadata,
        List<Citation> citations
) {
    public ToolResult {
        // Copied in insertion order; values may be null, so Map.copyOf does not fit.
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        citations = citations == null ? List.of() : List.copyOf(citations);
    }

    public static ToolResult success(String content, Map<String, Object> metadata, List<Citation> citations) {
        return new ToolResult(content, false, metadata, citations);
    }

    public static ToolResult error(String content) {
        return new ToolResult(content, true, Map.of(), List.of());
    }

    public static ToolResult error(String content, Map<String, Object> metadata) {
        return new ToolResult(content, true, metadata, List.of());
    }
}
