package com.smurthy.ai.search.controllers;

import com.smurthy.ai.search.config.PerplexityProperties;
import com.smurthy.ai.search.domain.CallContext;
import com.smurthy.ai.search.domain.Cancellation;
import com.smurthy.ai.search.mcp.McpProtocolDispatcher;
import com.smurthy.ai.search.mcp.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.CallableProcessingInterceptor;
import org.springframework.web.context.request.async.WebAsyncTask;

import java.time.Duration;

/**
 * HTTP transport for the MCP server.
 *
 * Endpoints:
 * - POST /mcp     one JSON-RPC message in, one JSON-RPC message out
 * - GET  /health
 *
 * The body is passed to the dispatcher as raw bytes, so malformed JSON
 * still gets a JSON-RPC parse error instead of an HTTP 400. Each message
 * is handled as an async task whose call is cancelled when the client
 * connection fails or the async request times out. Notifications are
 * acknowledged with 202 and no body.
 */
@RestController
public class McpController {

    private static final Logger log = LoggerFactory.getLogger(McpController.class);

    static final Duration ASYNC_GRACE = Duration.ofSeconds(5);

    private final McpProtocolDispatcher dispatcher;
    private final ToolRegistry toolRegistry;
    private final long asyncTimeoutMillis;

    public McpController(McpProtocolDispatcher dispatcher, ToolRegistry toolRegistry, PerplexityProperties properties) {
        this.dispatcher = dispatcher;
        this.toolRegistry = toolRegistry;
        this.asyncTimeoutMillis = properties.requestTimeout().plus(ASYNC_GRACE).toMillis();
    }

    @PostMapping(path = "/mcp", produces = MediaType.APPLICATION_JSON_VALUE)
    public WebAsyncTask<Object> handle(@RequestBody(required = false) byte[] body) {
        byte[] request = body == null ? new byte[0] : body;
        Cancellation cancellation = new Cancellation();
        CallContext ctx = CallContext.background().withCancellation(cancellation);

        WebAsyncTask<Object> task = new WebAsyncTask<>(asyncTimeoutMillis, () -> respond(dispatcher.handle(ctx, request)));
        task.onTimeout(() -> {
            log.warn("MCP request exceeded async timeout of {} ms, cancelling", asyncTimeoutMillis);
            cancellation.cancel();
            return CallableProcessingInterceptor.RESULT_NONE;
        });
        task.onError(() -> {
            log.warn("MCP request failed at the transport, cancelling");
            cancellation.cancel();
            return CallableProcessingInterceptor.RESULT_NONE;
        });
        return task;
    }

    @GetMapping(path = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public HealthResponse health() {
        return new HealthResponse("UP", toolRegistry.size());
    }

    static ResponseEntity<byte[]> respond(byte[] response) {
        if (response.length == 0) {
            return ResponseEntity.accepted().build();
        }
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(response);
    }

    public record HealthResponse(String status, int tools) {}
}
