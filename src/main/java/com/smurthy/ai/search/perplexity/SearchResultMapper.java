package com.smurthy.ai.search.perplexity;

import com.fasterxml.jackson.databind.JsonNode;
import com.smurthy.ai.search.domain.Citation;
import com.smurthy.ai.search.domain.DomainException;
import com.smurthy.ai.search.domain.ErrorKind;
import com.smurthy.ai.search.domain.SearchResult;
import com.smurthy.ai.search.domain.Source;
import com.smurthy.ai.search.domain.Usage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts an upstream chat-completions response into a {@link SearchResult}.
 *
 * Pure function. Content is the first choice's message text, or an empty
 * string when there are no choices. Citations and sources keep upstream
 * order; missing arrays become empty lists.
 */
public class SearchResultMapper {

    public SearchResult toSearchResult(ChatCompletion.Response response) {
        if (response == null) {
            throw new DomainException(ErrorKind.API_ERROR, "empty response body");
        }

        ChatCompletion.ApiUsage apiUsage = response.usage();
        Usage usage = apiUsage == null
                ? Usage.EMPTY
                : new Usage(apiUsage.promptTokens(), apiUsage.completionTokens(), apiUsage.totalTokens());

        return new SearchResult(
                response.id(),
                firstChoiceContent(response.choices()),
                response.model(),
                usage,
                mapCitations(response.citations()),
                mapSources(response.sources()),
                Instant.ofEpochSecond(response.created())
        );
    }

    private String firstChoiceContent(List<ChatCompletion.Choice> choices) {
        if (choices == null || choices.isEmpty()) {
            return "";
        }
        ChatCompletion.Message message = choices.get(0).message();
        if (message == null || message.content() == null) {
            return "";
        }
        return message.content();
    }

    private List<Citation> mapCitations(List<JsonNode> citations) {
        if (citations == null || citations.isEmpty()) {
            return List.of();
        }
        List<Citation> mapped = new ArrayList<>(citations.size());
        for (int i = 0; i < citations.size(); i++) {
            mapped.add(toCitation(citations.get(i), i + 1));
        }
        return mapped;
    }

    // Bare URL strings are numbered by position, starting at 1.
    private Citation toCitation(JsonNode node, int position) {
        if (node == null || node.isNull()) {
            throw new DomainException(ErrorKind.API_ERROR, "citation " + position + " is null");
        }
        if (node.isTextual()) {
            return new Citation(position, node.asText(), "");
        }
        if (node.isObject()) {
            return new Citation(
                    node.path("number").asInt(position),
                    node.path("url").asText(""),
                    node.path("title").asText(""));
        }
        throw new DomainException(ErrorKind.API_ERROR,
                "citation " + position + " has unexpected type " + node.getNodeType());
    }

    private List<Source> mapSources(List<ChatCompletion.ApiSource> sources) {
        if (sources == null || sources.isEmpty()) {
            return List.of();
        }
        List<Source> mapped = new ArrayList<>(sources.size());
        for (ChatCompletion.ApiSource source : sources) {
            if (source == null) {
                throw new DomainException(ErrorKind.API_ERROR, "source entry is null");
            }
            mapped.add(new Source(source.url(), source.title(), source.snippet()));
        }
        return mapped;
    }
}
