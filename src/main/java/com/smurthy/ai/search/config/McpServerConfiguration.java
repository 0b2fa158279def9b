package com.smurthy.ai.search.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smurthy.ai.search.mcp.McpProtocolDispatcher;
import com.smurthy.ai.search.mcp.McpResults;
import com.smurthy.ai.search.mcp.PerplexitySearchTool;
import com.smurthy.ai.search.mcp.ToolRegistry;
import com.smurthy.ai.search.service.SearchService;
import com.smurthy.ai.search.validation.SearchRequestValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Set;

/**
 * MCP server wiring: one registry per application, with the search tool
 * registered and the required-tool check run before the dispatcher is
 * handed out. A missing required tool aborts startup.
 */
@Configuration
public class McpServerConfiguration {

    private static final Logger log = LoggerFactory.getLogger(McpServerConfiguration.class);

    static final Set<String> REQUIRED_TOOLS = Set.of(PerplexitySearchTool.NAME);

    @Bean
    public PerplexitySearchTool perplexitySearchTool(SearchRequestValidator validator,
                                                     SearchService searchService,
                                                     ObjectMapper objectMapper) {
        return new PerplexitySearchTool(validator, searchService, objectMapper);
    }

    @Bean
    public ToolRegistry toolRegistry(PerplexitySearchTool perplexitySearchTool, PerplexityProperties properties) {
        ToolRegistry registry = new ToolRegistry(REQUIRED_TOOLS, properties.requestTimeout());
        registry.register(perplexitySearchTool.name(), perplexitySearchTool);
        registry.start();
        return registry;
    }

    @Bean
    public McpProtocolDispatcher mcpProtocolDispatcher(ToolRegistry toolRegistry,
                                                       ObjectMapper objectMapper,
                                                       PerplexityProperties properties,
                                                       @Value("${mcp.server.name:perplexity-mcp-server}") String serverName,
                                                       @Value("${mcp.server.version:1.0.0}") String serverVersion) {
        log.info("MCP dispatcher ready: server={} {}, tools={}", serverName, serverVersion, toolRegistry.size());
        return new McpProtocolDispatcher(
                toolRegistry,
                objectMapper,
                new McpResults.ServerInfo(serverName, serverVersion),
                properties.requestTimeout());
    }
}
