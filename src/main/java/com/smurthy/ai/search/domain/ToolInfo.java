package com.smurthy.ai.search.domain;

import java.util.Map;

/**
 * Listing entry for a registered capability.
 */
public record ToolInfo(String name, String description, Map<String, Object> inputSchema) {
}
