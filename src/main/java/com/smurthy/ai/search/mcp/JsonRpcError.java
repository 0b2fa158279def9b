package com.smurthy.ai.search.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error member of a JSON-RPC response. {@code data} only ever holds an
 * error message, never upstream bodies or credentials.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JsonRpcError(int code, String message, String data) {
}
