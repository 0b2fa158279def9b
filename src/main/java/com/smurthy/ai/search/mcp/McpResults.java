package com.smurthy.ai.search.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.smurthy.ai.search.domain.Citation;
import com.smurthy.ai.search.domain.ToolInfo;
import com.smurthy.ai.search.domain.ToolResult;

import java.util.List;
import java.util.Map;

/**
 * Result payloads of the MCP methods served by the dispatcher.
 */
public final class McpResults {

    public static final String PROTOCOL_VERSION = "2024-11-05";

    private McpResults() {
    }

    public record ToolsList(List<ToolInfo> tools) {
    }

    public record TextContent(String type, String text) {

        public static TextContent of(String text) {
            return new TextContent("text", text == null ? "" : text);
        }
    }

    public record ToolCall(
            List<TextContent> content,
            @JsonProperty("isError") boolean isError,
            @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, Object> metadata,
            @JsonInclude(JsonInclude.Include.NON_EMPTY) List<Citation> citations
    ) {

        public static ToolCall from(ToolResult result) {
            return new ToolCall(
                    List.of(TextContent.of(result.content())),
                    result.isError(),
                    result.metadata(),
                    result.citations());
        }
    }

    public record ServerInfo(String name, String version) {
    }

    public record Initialize(String protocolVersion, Map<String, Object> capabilities, ServerInfo serverInfo) {

        public static Initialize of(ServerInfo serverInfo) {
            return new Initialize(PROTOCOL_VERSION, Map.of("tools", Map.of("listChanged", false)), serverInfo);
        }
    }
}
