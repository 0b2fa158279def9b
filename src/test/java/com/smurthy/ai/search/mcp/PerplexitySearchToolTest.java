package com.smurthy.ai.search.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smurthy.ai.search.domain.CallContext;
import com.smurthy.ai.search.domain.Citation;
import com.smurthy.ai.search.domain.ConfigProvider;
import com.smurthy.ai.search.domain.DomainException;
import com.smurthy.ai.search.domain.ErrorKind;
import com.smurthy.ai.search.domain.PerplexityClient;
import com.smurthy.ai.search.domain.SearchModel;
import com.smurthy.ai.search.domain.SearchRequest;
import com.smurthy.ai.search.domain.SearchResult;
import com.smurthy.ai.search.domain.Source;
import com.smurthy.ai.search.domain.ToolResult;
import com.smurthy.ai.search.domain.Usage;
import com.smurthy.ai.search.service.SearchService;
import com.smurthy.ai.search.test.TestJson;
import com.smurthy.ai.search.validation.SearchRequestValidator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the perplexity_search tool, with the upstream client mocked.
 */
@ExtendWith(MockitoExtension.class)
class PerplexitySearchToolTest {

    private static final Instant CREATED = Instant.parse("2026-02-03T04:05:06Z");

    @Mock
    private PerplexityClient client;

    private final ObjectMapper objectMapper = TestJson.mapper();

    private PerplexitySearchTool tool;

    @BeforeEach
    void setUp() {
        ConfigProvider config = new ConfigProvider() {
            @Override
            public String apiKey() {
                return "test-key";
            }

            @Override
            public String defaultModel() {
                return "sonar";
            }

            @Override
            public Duration requestTimeout() {
                return Duration.ofSeconds(5);
            }

            @Override
            public String logLevel() {
                return "info";
            }
        };
        tool = new PerplexitySearchTool(new SearchRequestValidator(), new SearchService(client, config), objectMapper);
    }

    @Test
    @DisplayName("Describes itself with a strict input schema")
    void testSchema() {
        Map<String, Object> schema = tool.inputSchema();

        assertThat(tool.name()).isEqualTo("perplexity_search");
        assertThat(tool.description()).contains("Perplexity");
        assertThat(schema).containsEntry("type", "object")
                .containsEntry("required", List.of("query"))
                .containsEntry("additionalProperties", false);
        @SuppressWarnings("unchecked")
        Map<String, Object> properties = (Map<String, Object>) schema.get("properties");
        assertThat(properties).containsOnlyKeys("query", "model", "search_mode", "max_tokens",
                "date_range", "sources", "options");
        @SuppressWarnings("unchecked")
        Map<String, Object> model = (Map<String, Object>) properties.get("model");
        assertThat(model.get("enum")).isEqualTo(SearchModel.ids());
    }

    @Test
    @DisplayName("Returns the search result as pretty JSON with metadata and citations")
    void testSuccessfulSearch() throws Exception {
        // Given
        List<Citation> citations = List.of(new Citation(1, "https://example.com/qc", "QC"));
        SearchResult result = new SearchResult("resp-9", "Quantum computers use qubits.", "sonar",
                new Usage(5, 37, 42), citations, List.of(new Source("https://example.com/qc", "QC", "qubits")), CREATED);
        when(client.search(any(), any())).thenReturn(result);

        // When
        ToolResult toolResult = tool.execute(CallContext.background(),
                Map.of("query", "What is quantum computing?", "date_range", "week"));

        // Then
        assertThat(toolResult.isError()).isFalse();
        assertThat(toolResult.content()).contains("\n");
        JsonNode content = objectMapper.readTree(toolResult.content());
        assertThat(content.get("id").asText()).isEqualTo("resp-9");
        assertThat(content.get("content").asText()).isEqualTo("Quantum computers use qubits.");
        assertThat(content.get("usage").get("total_tokens").asInt()).isEqualTo(42);
        assertThat(content.get("created").asText()).isEqualTo("2026-02-03T04:05:06Z");

        assertThat(toolResult.metadata())
                .containsEntry("result_id", "resp-9")
                .containsEntry("model", "sonar")
                .containsEntry("usage", new Usage(5, 37, 42))
                .containsEntry("created", "2026-02-03T04:05:06Z")
                .containsEntry("sources_count", 1)
                .containsEntry("citations_count", 1);
        assertThat(toolResult.citations()).isEqualTo(citations);

        ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
        verify(client).search(any(), captor.capture());
        assertThat(captor.getValue().model()).isEqualTo(SearchModel.SONAR);
        assertThat(captor.getValue().dateRange().value()).isEqualTo("week");
    }

    @Test
    @DisplayName("Invalid arguments fail before the upstream is called")
    void testInvalidArguments() {
        assertThatThrownBy(() -> tool.execute(CallContext.background(), Map.of()))
                .isInstanceOf(DomainException.class)
                .satisfies(e -> assertThat(((DomainException) e).getKind()).isEqualTo(ErrorKind.INVALID_REQUEST));
        verifyNoInteractions(client);
    }

    @Test
    @DisplayName("Upstream failures propagate with their kind")
    void testUpstreamFailure() {
        when(client.search(any(), any())).thenThrow(new DomainException(ErrorKind.AUTH_ERROR, "unauthorized"));

        assertThatThrownBy(() -> tool.execute(CallContext.background(), Map.of("query", "q")))
                .isInstanceOf(DomainException.class)
                .satisfies(e -> assertThat(((DomainException) e).getKind()).isEqualTo(ErrorKind.AUTH_ERROR));
    }
}
