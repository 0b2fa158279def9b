package com.smurthy.ai.search.mcp;

import com.smurthy.ai.search.domain.CallContext;
import com.smurthy.ai.search.domain.DomainException;
import com.smurthy.ai.search.domain.ErrorKind;
import com.smurthy.ai.search.domain.ToolExecution;
import com.smurthy.ai.search.domain.ToolInfo;
import com.smurthy.ai.search.domain.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Name to capability map shared by all concurrent calls.
 *
 * Reads (execute, list) take the read lock; registration takes the write
 * lock. A capability is looked up under the lock and run after the lock is
 * released, so a slow upstream call never blocks registration.
 *
 * Re-registering an existing name replaces the previous capability.
 */
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private final Map<String, Tool> tools = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Set<String> requiredTools;
    private final Duration defaultTimeout;

    public ToolRegistry(Set<String> requiredTools) {
        this(requiredTools, DEFAULT_TIMEOUT);
    }

    public ToolRegistry(Set<String> requiredTools, Duration defaultTimeout) {
        this.requiredTools = Set.copyOf(requiredTools);
        this.defaultTimeout = defaultTimeout;
    }

    public void register(String name, Tool tool) {
        if (name == null || name.isEmpty()) {
            throw new DomainException(ErrorKind.INVALID_REQUEST, "tool name cannot be empty");
        }
        if (tool == null) {
            throw new DomainException(ErrorKind.INVALID_REQUEST, "tool cannot be null");
        }
        if (!name.equals(tool.name())) {
            throw new DomainException(ErrorKind.INVALID_REQUEST, String.format(
                    "tool name mismatch: registered as '%s' but tool reports name '%s'", name, tool.name()));
        }

        lock.writeLock().lock();
        try {
            Tool previous = tools.put(name, tool);
            if (previous != null) {
                log.warn("Tool '{}' already registered, replacing", name);
            }
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Tool registered: {}", name);
    }

    /**
     * Runs the named capability.
     *
     * Never throws for a lookup or execution failure: the returned
     * {@link ToolExecution} then carries an error-flagged result together
     * with the {@code TOOL_NOT_FOUND} or {@code TOOL_EXECUTION} error.
     */
    public ToolExecution execute(CallContext ctx, String name, Map<String, Object> args) {
        CallContext bounded = ctx.withDefaultTimeout(defaultTimeout);
        Map<String, Object> arguments = args == null ? Map.of() : args;

        Tool tool;
        lock.readLock().lock();
        try {
            tool = tools.get(name);
        } finally {
            lock.readLock().unlock();
        }

        if (tool == null) {
            log.error("Tool not found: {}", name);
            return ToolExecution.failure(
                    ToolResult.error(String.format("Tool '%s' not found", name)),
                    new DomainException(ErrorKind.TOOL_NOT_FOUND, String.format("tool '%s' not found", name)));
        }

        log.info("Executing tool: name={}, args={}", name, arguments.size());

        ToolResult result;
        try {
            result = tool.execute(bounded, arguments);
        } catch (RuntimeException e) {
            log.error("Tool execution failed: name={}, error={}", name, e.getMessage());
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("tool_name", name);
            metadata.put("error_type", "execution_error");
            if (e instanceof DomainException domain) {
                metadata.put("error_kind", domain.getKind().name());
            }
            return ToolExecution.failure(
                    ToolResult.error("Tool execution failed: " + e.getMessage(), metadata),
                    DomainException.wrap(ErrorKind.TOOL_EXECUTION, e));
        }

        if (result == null) {
            log.error("Tool returned no result: {}", name);
            return ToolExecution.failure(
                    ToolResult.error("Tool execution failed: no result"),
                    new DomainException(ErrorKind.TOOL_EXECUTION, "tool '" + name + "' returned no result"));
        }

        log.info("Tool execution completed: name={}, isError={}, contentLength={}, metadataKeys={}, citations={}",
                name, result.isError(), result.content() == null ? 0 : result.content().length(),
                result.metadata().size(), result.citations().size());
        return ToolExecution.success(result);
    }

    /**
     * Snapshot of the registered capabilities. Order is unspecified.
     */
    public List<ToolInfo> list() {
        lock.readLock().lock();
        try {
            List<ToolInfo> infos = new ArrayList<>(tools.size());
            for (Tool tool : tools.values()) {
                infos.add(new ToolInfo(tool.name(), tool.description(), tool.inputSchema()));
            }
            log.debug("Listed {} tools", infos.size());
            return infos;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Boot-time check that every required capability is registered.
     *
     * @throws DomainException with kind {@code CONFIGURATION_ERROR} naming the first missing tool
     */
    public void start() {
        log.info("Starting MCP tool registry");
        int count;
        lock.readLock().lock();
        try {
            for (String required : requiredTools.stream().sorted().toList()) {
                if (!tools.containsKey(required)) {
                    throw new DomainException(ErrorKind.CONFIGURATION_ERROR,
                            "required tool '" + required + "' not registered");
                }
            }
            count = tools.size();
        } finally {
            lock.readLock().unlock();
        }
        log.info("MCP tool registry started: tools={}, required={}", count, requiredTools);
    }

    public int size() {
        lock.readLock().lock();
        try {
            return tools.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String name) {
        lock.readLock().lock();
        try {
            return tools.containsKey(name);
        } finally {
            lock.readLock().unlock();
        }
    }
}
