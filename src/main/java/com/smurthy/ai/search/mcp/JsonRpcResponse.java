package com.smurthy.ai.search.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON-RPC 2.0 response envelope. Exactly one of {@code result} and
 * {@code error} is set; {@code id} echoes the request id and is written as
 * {@code null} when the request id could not be read.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JsonRpcResponse(
        String jsonrpc,
        @JsonInclude(JsonInclude.Include.ALWAYS) JsonNode id,
        Object result,
        JsonRpcError error
) {

    public static final String VERSION = "2.0";

    public static JsonRpcResponse success(JsonNode id, Object result) {
        return new JsonRpcResponse(VERSION, id, result, null);
    }

    public static JsonRpcResponse failure(JsonNode id, JsonRpcError error) {
        return new JsonRpcResponse(VERSION, id, null, error);
    }
}
