package com.smurthy.ai.search.domain;

/**
 * Fixed set of error kinds used across the server, independent of
 * JSON-RPC error codes and HTTP status codes.
 *
 * Each kind owns the sentinel text that prefixes every message raised
 * with it, so callers can classify an error from its message alone.
 */
public enum ErrorKind {

    INVALID_REQUEST("invalid request parameters"),
    AUTH_ERROR("perplexity API key rejected or missing"),
    RATE_LIMITED("rate limit exceeded"),
    API_ERROR("perplexity API error"),
    NETWORK_ERROR("network connection error"),
    TIMEOUT_ERROR("request timeout"),
    TOOL_NOT_FOUND("tool not found"),
    TOOL_EXECUTION("tool execution failed"),
    MCP_PROTOCOL("MCP protocol error"),
    CONFIGURATION_ERROR("configuration error");

    private final String sentinel;

    ErrorKind(String sentinel) {
        this.sentinel = sentinel;
    }

    public String sentinel() {
        return sentinel;
    }

    /**
     * Only transport failures are candidates for a retry policy.
     * Timeouts are excluded because the caller's deadline is already spent.
     */
    public boolean isTransient() {
        return this == NETWORK_ERROR;
    }

    /**
     * Client-side errors are the caller's fault and never worth repeating.
     */
    public boolean isClientError() {
        return this == INVALID_REQUEST;
    }
}
