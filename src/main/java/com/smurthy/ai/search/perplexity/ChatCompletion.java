package com.smurthy.ai.search.perplexity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Wire shapes of the Perplexity chat-completions endpoint.
 *
 * API Docs: https://docs.perplexity.ai/api-reference/chat-completions
 */
public final class ChatCompletion {

    public static final String ROLE_USER = "user";

    private ChatCompletion() {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Message(String role, String content) {
    }

    /**
     * Request body. Optional fields are left {@code null} and omitted from the JSON.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Request(
            String model,
            List<Message> messages,
            @JsonProperty("max_tokens") Integer maxTokens,
            Double temperature,
            @JsonProperty("top_p") Double topP,
            @JsonProperty("search_mode") String searchMode,
            @JsonProperty("search_recency_filter") String searchRecencyFilter,
            @JsonProperty("search_domain_filter") List<String> searchDomainFilter,
            @JsonProperty("disable_search") Boolean disableSearch,
            boolean stream
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Choice(int index, Message message, @JsonProperty("finish_reason") String finishReason) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ApiUsage(
            @JsonProperty("prompt_tokens") int promptTokens,
            @JsonProperty("completion_tokens") int completionTokens,
            @JsonProperty("total_tokens") int totalTokens
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ApiSource(String url, String title, String snippet) {
    }

    /**
     * Response body. Citations arrive either as bare URL strings or as
     * {@code {number, url, title}} objects, so they stay as raw nodes until mapped.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Response(
            String id,
            String object,
            long created,
            String model,
            List<Choice> choices,
            ApiUsage usage,
            List<JsonNode> citations,
            List<ApiSource> sources
    ) {
    }

    /**
     * Structured error body: {@code {"error": {"message", "type", "code"}}}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ErrorEnvelope(ErrorDetail error) {

        public boolean isStructured() {
            return error != null && error.message() != null && !error.message().isBlank();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ErrorDetail(String message, String type, JsonNode code) {
    }
}
