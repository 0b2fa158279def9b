package com.smurthy.ai.search.mcp;

import com.smurthy.ai.search.domain.CallContext;
import com.smurthy.ai.search.domain.ToolResult;

import java.util.Map;

/**
 * A named, schema-described capability that can be registered with the
 * {@link ToolRegistry} and invoked through {@code tools/call}.
 */
public interface Tool {

    /**
     * Must equal the key the tool is registered under.
     */
    String name();

    String description();

    /**
     * JSON Schema of the accepted arguments, serialized as-is into {@code tools/list}.
     */
    Map<String, Object> inputSchema();

    /**
     * Runs the capability.
     *
     * @param args raw, untrusted call arguments
     * @throws com.smurthy.ai.search.domain.DomainException when the call fails
     */
    ToolResult execute(CallContext ctx, Map<String, Object> args);
}
