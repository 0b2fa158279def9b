package com.smurthy.ai.search.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smurthy.ai.search.domain.CallContext;
import com.smurthy.ai.search.domain.DateRange;
import com.smurthy.ai.search.domain.DomainException;
import com.smurthy.ai.search.domain.ErrorKind;
import com.smurthy.ai.search.domain.SearchMode;
import com.smurthy.ai.search.domain.SearchModel;
import com.smurthy.ai.search.domain.SearchRequest;
import com.smurthy.ai.search.domain.SearchResult;
import com.smurthy.ai.search.domain.ToolResult;
import com.smurthy.ai.search.service.SearchService;
import com.smurthy.ai.search.validation.SearchRequestValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The {@code perplexity_search} capability.
 *
 * Validates the raw call arguments, runs the search and returns the
 * result as pretty-printed JSON, with ids, usage and counts repeated in
 * the metadata and the citations attached to the tool result.
 */
public class PerplexitySearchTool implements Tool {

    private static final Logger log = LoggerFactory.getLogger(PerplexitySearchTool.class);

    public static final String NAME = "perplexity_search";

    private static final String DESCRIPTION = "Search for information using Perplexity AI Sonar models. "
            + "Provides real-time web search with citations and sources, supporting academic search, "
            + "news search, and domain filtering.";

    private final SearchRequestValidator validator;
    private final SearchService searchService;
    private final ObjectMapper objectMapper;
    private final Map<String, Object> inputSchema;

    public PerplexitySearchTool(SearchRequestValidator validator, SearchService searchService, ObjectMapper objectMapper) {
        this.validator = validator;
        this.searchService = searchService;
        this.objectMapper = objectMapper;
        this.inputSchema = buildInputSchema();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return DESCRIPTION;
    }

    @Override
    public Map<String, Object> inputSchema() {
        return inputSchema;
    }

    @Override
    public ToolResult execute(CallContext ctx, Map<String, Object> args) {
        log.debug("[TOOL] {} invoked with {} arguments", NAME, args.size());

        SearchRequest request = validator.validate(args);
        SearchResult result = searchService.execute(ctx, request);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("result_id", result.id());
        metadata.put("model", result.model());
        metadata.put("usage", result.usage());
        metadata.put("created", result.created().toString());
        metadata.put("sources_count", result.sources().size());
        metadata.put("citations_count", result.citations().size());

        log.info("[TOOL] {} completed: id={}, contentLength={}, citations={}, sources={}",
                NAME, result.id(), result.content().length(), result.citations().size(), result.sources().size());

        return ToolResult.success(format(result), metadata, result.citations());
    }

    private String format(SearchResult result) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new DomainException(ErrorKind.TOOL_EXECUTION, "failed to format search result", e);
        }
    }

    private static Map<String, Object> buildInputSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("query", Map.of(
                "type", "string",
                "description", "The search query to execute",
                "minLength", 1,
                "maxLength", SearchRequest.MAX_QUERY_LENGTH));
        properties.put("model", Map.of(
                "type", "string",
                "description", "The Sonar model to use for search (optional, defaults to 'sonar')",
                "enum", SearchModel.ids(),
                "default", SearchModel.SONAR.id()));
        properties.put("search_mode", Map.of(
                "type", "string",
                "description", "The search mode to use (optional, defaults to 'web')",
                "enum", SearchMode.allValues(),
                "default", SearchMode.WEB.value()));
        properties.put("max_tokens", Map.of(
                "type", "number",
                "description", "Maximum number of tokens in the response (optional)",
                "minimum", 1,
                "maximum", SearchRequest.MAX_TOKENS));
        properties.put("date_range", Map.of(
                "type", "string",
                "description", "Filter search results by date range (optional)",
                "enum", DateRange.allValues()));
        properties.put("sources", Map.of(
                "type", "array",
                "description", "Limit search to specific domains (optional, max 10)",
                "items", Map.of("type", "string"),
                "maxItems", SearchRequest.MAX_SOURCES_COUNT));
        properties.put("options", Map.of(
                "type", "object",
                "description", "Additional search options (optional): temperature, top_p, "
                        + "disable_search, search_domain_filter, search_mode",
                "additionalProperties", Map.of("type", "string"),
                "maxProperties", SearchRequest.MAX_OPTIONS_COUNT));

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", List.of("query"));
        schema.put("additionalProperties", false);
        return Collections.unmodifiableMap(schema);
    }
}
