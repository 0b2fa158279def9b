package com.smurthy.ai.search.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.smurthy.ai.search.domain.CallContext;
import com.smurthy.ai.search.domain.DomainException;
import com.smurthy.ai.search.domain.ErrorKind;
import com.smurthy.ai.search.domain.ToolExecution;
import com.smurthy.ai.search.domain.ToolInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Entry point for JSON-RPC messages.
 *
 * {@link #handle(CallContext, byte[])} never throws: every input, however
 * malformed, yields exactly one JSON-RPC response. If even the error
 * response cannot be serialized a pre-built {@code -32603} envelope is
 * returned. The one exception is a client notification (a
 * {@code notifications/*} method without an {@code id} member), which is
 * acknowledged with an empty array and no response.
 *
 * Supported methods:
 * - initialize
 * - ping
 * - tools/list
 * - tools/call
 *
 * Only methods, ids, sizes and error kinds are logged, never payloads.
 */
public class McpProtocolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(McpProtocolDispatcher.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    static final String NOTIFICATION_PREFIX = "notifications/";

    private static final byte[] NO_RESPONSE = new byte[0];

    static final byte[] FALLBACK_RESPONSE =
            "{\"jsonrpc\":\"2.0\",\"id\":null,\"error\":{\"code\":-32603,\"message\":\"Internal error\"}}"
                    .getBytes(StandardCharsets.UTF_8);

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final ToolRegistry registry;
    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;
    private final McpResults.ServerInfo serverInfo;
    private final Duration defaultTimeout;

    public McpProtocolDispatcher(ToolRegistry registry, ObjectMapper objectMapper, McpResults.ServerInfo serverInfo) {
        this(registry, objectMapper, serverInfo, DEFAULT_TIMEOUT);
    }

    public McpProtocolDispatcher(ToolRegistry registry,
                                 ObjectMapper objectMapper,
                                 McpResults.ServerInfo serverInfo,
                                 Duration defaultTimeout) {
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.serverInfo = serverInfo;
        this.defaultTimeout = defaultTimeout;
    }

    public byte[] handle(CallContext ctx, byte[] requestData) {
        CallContext bounded = ctx.withDefaultTimeout(defaultTimeout);
        int requestSize = requestData == null ? 0 : requestData.length;
        log.debug("Handling MCP request: size={}", requestSize);

        JsonNode root;
        try {
            root = requestSize == 0 ? null : strictReader.readTree(requestData);
        } catch (IOException e) {
            log.warn("Rejected MCP request: parse error, size={}", requestSize);
            return errorResponse(null, JsonRpcErrorCode.PARSE_ERROR, "Parse error", "invalid JSON");
        }
        if (root == null || root.isMissingNode()) {
            log.warn("Rejected MCP request: empty body");
            return errorResponse(null, JsonRpcErrorCode.PARSE_ERROR, "Parse error", "empty request");
        }

        JsonNode id = root.isObject() ? root.get("id") : null;
        String method;
        try {
            method = validateEnvelope(root);
        } catch (DomainException e) {
            log.warn("Rejected MCP request: id={}, reason={}", id, e.getMessage());
            return errorResponse(id, JsonRpcErrorCode.INVALID_REQUEST, "Invalid Request", e.getMessage());
        }

        if (isNotification(root, method)) {
            log.debug("Acknowledged MCP notification: method={}", method);
            return NO_RESPONSE.clone();
        }

        log.info("Processing MCP request: method={}, id={}", method, id);

        Object result;
        try {
            switch (method) {
                case "initialize" -> result = McpResults.Initialize.of(serverInfo);
                case "ping" -> result = Map.of();
                case "tools/list" -> result = handleToolsList();
                case "tools/call" -> result = handleToolCall(bounded, root.get("params"));
                default -> {
                    log.warn("Unknown MCP method: {}, supported={}", method, supportedMethods());
                    return errorResponse(id, JsonRpcErrorCode.METHOD_NOT_FOUND, "Method not found: " + method,
                            "supported methods: " + String.join(", ", supportedMethods()));
                }
            }
        } catch (RuntimeException e) {
            log.error("MCP method execution failed: method={}, id={}, error={}", method, id, e.getMessage());
            return errorResponse(id, JsonRpcErrorCode.SERVER_ERROR, "Server error", e.getMessage());
        }

        byte[] response;
        try {
            response = objectMapper.writeValueAsBytes(JsonRpcResponse.success(id, result));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize MCP response: method={}, id={}", method, id);
            return errorResponse(id, JsonRpcErrorCode.INTERNAL_ERROR, "Internal error", e.getOriginalMessage());
        }

        log.info("MCP request processed: method={}, id={}, responseSize={}", method, id, response.length);
        return response;
    }

    public List<String> supportedMethods() {
        return List.of("initialize", "ping", "tools/list", "tools/call");
    }

    private static boolean isNotification(JsonNode root, String method) {
        return !root.has("id") && method.startsWith(NOTIFICATION_PREFIX);
    }

    /**
     * Checks version and method, returning the method name.
     *
     * @throws DomainException with kind {@code MCP_PROTOCOL}
     */
    String validateEnvelope(JsonNode root) {
        if (!root.isObject()) {
            throw new DomainException(ErrorKind.MCP_PROTOCOL, "request must be a JSON object");
        }
        JsonNode version = root.get("jsonrpc");
        if (version == null || !version.isTextual() || !JsonRpcResponse.VERSION.equals(version.asText())) {
            throw new DomainException(ErrorKind.MCP_PROTOCOL, "invalid JSONRPC version");
        }
        JsonNode method = root.get("method");
        if (method == null || !method.isTextual() || method.asText().isBlank()) {
            throw new DomainException(ErrorKind.MCP_PROTOCOL, "method is required");
        }
        return method.asText();
    }

    private McpResults.ToolsList handleToolsList() {
        List<ToolInfo> tools = registry.list();
        log.info("Tools listed: count={}", tools.size());
        return new McpResults.ToolsList(tools);
    }

    private McpResults.ToolCall handleToolCall(CallContext ctx, JsonNode params) {
        if (params != null && !params.isNull() && !params.isObject()) {
            throw new DomainException(ErrorKind.INVALID_REQUEST, "invalid tool call parameters: params must be an object");
        }
        JsonNode nameNode = params == null ? null : params.get("name");
        String name = nameNode != null && nameNode.isTextual() ? nameNode.asText() : "";
        if (name.isEmpty()) {
            throw new DomainException(ErrorKind.INVALID_REQUEST, "tool name is required");
        }

        Map<String, Object> arguments = decodeArguments(params.get("arguments"));
        log.debug("Parsed tool call: name={}, args={}", name, arguments.size());

        ToolExecution execution = registry.execute(ctx, name, arguments);
        execution.failure()
                .filter(error -> error.getKind() == ErrorKind.TOOL_NOT_FOUND)
                .ifPresent(error -> {
                    throw error;
                });

        if (execution.failed()) {
            log.warn("Tool call failed: name={}, kind={}", name, execution.error().getKind());
        } else {
            log.info("Tool call completed: name={}", name);
        }
        return McpResults.ToolCall.from(execution.result());
    }

    private Map<String, Object> decodeArguments(JsonNode arguments) {
        if (arguments == null || arguments.isNull()) {
            return Map.of();
        }
        if (!arguments.isObject()) {
            throw new DomainException(ErrorKind.INVALID_REQUEST, "invalid tool call parameters: arguments must be an object");
        }
        return objectMapper.convertValue(arguments, ARGUMENTS_TYPE);
    }

    private byte[] errorResponse(JsonNode id, int code, String message, String data) {
        try {
            return objectMapper.writeValueAsBytes(JsonRpcResponse.failure(id, new JsonRpcError(code, message, data)));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize MCP error response, using fallback envelope");
            return FALLBACK_RESPONSE.clone();
        }
    }
}
