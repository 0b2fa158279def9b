package com.smurthy.ai.search.domain;

import java.util.Optional;

/**
 * Result of running a capability through the registry.
 *
 * A failed execution carries both an error-flagged {@link ToolResult} and
 * the {@link DomainException} behind it. The protocol layer reads the
 * result, business callers read the error.
 */
public record ToolExecution(ToolResult result, DomainException error) {

    public static ToolExecution success(ToolResult result) {
        return new ToolExecution(result, null);
    }

    public static ToolExecution failure(ToolResult result, DomainException error) {
        return new ToolExecution(result, error);
    }

    public boolean failed() {
        return error != null;
    }

    public Optional<DomainException> failure() {
        return Optional.ofNullable(error);
    }
}
