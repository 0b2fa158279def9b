package com.smurthy.ai.search.mcp;

/**
 * JSON-RPC 2.0 error codes used by the dispatcher.
 */
public final class JsonRpcErrorCode {

    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INTERNAL_ERROR = -32603;
    public static final int SERVER_ERROR = -32000;

    private JsonRpcErrorCode() {
    }
}
