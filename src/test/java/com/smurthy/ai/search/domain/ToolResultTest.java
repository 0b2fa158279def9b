package com.smurthy.ai.search.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolResultTest {

    @Test
    @DisplayName("Metadata is copied, so later changes to the caller's map are not seen")
    void testMetadataCopied() {
        // Given
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("result_id", "resp-1");

        // When
        ToolResult result = ToolResult.success("answer", metadata, List.of());
        metadata.put("result_id", "changed");
        metadata.put("extra", 1);

        // Then
        assertThat(result.metadata()).containsOnly(Map.entry("result_id", "resp-1"));
    }

    @Test
    @DisplayName("Metadata is read-only and keeps insertion order")
    void testMetadataReadOnly() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("tool_name", "search");
        metadata.put("error_type", "execution_error");
        metadata.put("error_kind", null);

        ToolResult result = ToolResult.error("failed", metadata);

        assertThat(result.metadata().keySet()).containsExactly("tool_name", "error_type", "error_kind");
        assertThatThrownBy(() -> result.metadata().put("x", "y")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Null metadata and citations become empty")
    void testNullsBecomeEmpty() {
        ToolResult result = new ToolResult("text", false, null, null);

        assertThat(result.metadata()).isEmpty();
        assertThat(result.citations()).isEmpty();
    }
}
