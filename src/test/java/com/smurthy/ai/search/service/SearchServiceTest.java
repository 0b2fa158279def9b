package com.smurthy.ai.search.service;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.smurthy.ai.search.domain.CallContext;
import com.smurthy.ai.search.domain.ConfigProvider;
import com.smurthy.ai.search.domain.DomainException;
import com.smurthy.ai.search.domain.ErrorKind;
import com.smurthy.ai.search.domain.PerplexityClient;
import com.smurthy.ai.search.domain.SearchModel;
import com.smurthy.ai.search.domain.SearchRequest;
import com.smurthy.ai.search.domain.SearchResult;
import com.smurthy.ai.search.domain.Usage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for SearchService.
 *
 * Tests:
 * - default model substitution
 * - request timeout applied as a default deadline only
 * - upstream errors propagated unchanged
 * - failure log level chosen by error kind
 */
@ExtendWith(MockitoExtension.class)
class SearchServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private PerplexityClient client;

    private SearchService searchService;

    private final ListAppender<ILoggingEvent> logs = new ListAppender<>();

    @BeforeEach
    void setUp() {
        searchService = new SearchService(client, new TestConfig("sonar-reasoning", Duration.ofSeconds(20)));
        logs.start();
        serviceLogger().addAppender(logs);
    }

    @AfterEach
    void tearDown() {
        serviceLogger().detachAppender(logs);
        logs.stop();
    }

    @Test
    @DisplayName("Should substitute the configured default model when none is given")
    void testDefaultModelApplied() {
        // Given
        when(client.search(any(), any())).thenReturn(result());
        ArgumentCaptor<SearchRequest> requestCaptor = ArgumentCaptor.forClass(SearchRequest.class);

        // When
        SearchResult result = searchService.execute(CallContext.background(), SearchRequest.of("What is quantum computing?"));

        // Then
        assertThat(result.id()).isEqualTo("resp-1");
        verify(client).search(any(), requestCaptor.capture());
        assertThat(requestCaptor.getValue().model()).isEqualTo(SearchModel.SONAR_REASONING);
        assertThat(requestCaptor.getValue().query()).isEqualTo("What is quantum computing?");
    }

    @Test
    @DisplayName("Should keep an explicitly requested model")
    void testExplicitModelKept() {
        when(client.search(any(), any())).thenReturn(result());
        ArgumentCaptor<SearchRequest> requestCaptor = ArgumentCaptor.forClass(SearchRequest.class);

        searchService.execute(CallContext.background(), SearchRequest.of("q").withModel(SearchModel.SONAR_PRO));

        verify(client).search(any(), requestCaptor.capture());
        assertThat(requestCaptor.getValue().model()).isEqualTo(SearchModel.SONAR_PRO);
    }

    @Test
    @DisplayName("Should bound a deadline-free call with the configured request timeout")
    void testRequestTimeoutApplied() {
        // Given
        when(client.search(any(), any())).thenReturn(result());
        ArgumentCaptor<CallContext> ctxCaptor = ArgumentCaptor.forClass(CallContext.class);
        CallContext ctx = CallContext.background(Clock.fixed(NOW, ZoneOffset.UTC));

        // When
        searchService.execute(ctx, SearchRequest.of("q"));

        // Then
        verify(client).search(ctxCaptor.capture(), any());
        assertThat(ctxCaptor.getValue().deadline()).contains(NOW.plusSeconds(20));
    }

    @Test
    @DisplayName("Should not extend an earlier caller deadline")
    void testCallerDeadlineKept() {
        when(client.search(any(), any())).thenReturn(result());
        ArgumentCaptor<CallContext> ctxCaptor = ArgumentCaptor.forClass(CallContext.class);
        CallContext ctx = CallContext.background(Clock.fixed(NOW, ZoneOffset.UTC)).withTimeout(Duration.ofSeconds(2));

        searchService.execute(ctx, SearchRequest.of("q"));

        verify(client).search(ctxCaptor.capture(), any());
        assertThat(ctxCaptor.getValue().deadline()).contains(NOW.plusSeconds(2));
    }

    @Test
    @DisplayName("Should propagate upstream failures unchanged")
    void testUpstreamFailurePropagated() {
        // Given
        DomainException upstream = new DomainException(ErrorKind.RATE_LIMITED, "slow down");
        when(client.search(any(), any())).thenThrow(upstream);

        // When / Then
        assertThatThrownBy(() -> searchService.execute(CallContext.background(), SearchRequest.of("q")))
                .isSameAs(upstream)
                .hasMessage("rate limit exceeded: slow down");
    }

    @ParameterizedTest
    @CsvSource({
            "INVALID_REQUEST, WARN",
            "NETWORK_ERROR, WARN",
            "AUTH_ERROR, ERROR",
            "API_ERROR, ERROR",
            "TIMEOUT_ERROR, ERROR"
    })
    @DisplayName("Should log caller and transient failures at WARN, the rest at ERROR")
    void testFailureLogLevel(ErrorKind kind, String expectedLevel) {
        // Given
        when(client.search(any(), any())).thenThrow(new DomainException(kind, "boom"));

        // When
        assertThatThrownBy(() -> searchService.execute(CallContext.background(), SearchRequest.of("q")))
                .isInstanceOf(DomainException.class);

        // Then
        assertThat(logs.list)
                .filteredOn(event -> event.getFormattedMessage().startsWith("Search failed"))
                .singleElement()
                .satisfies(event -> {
                    assertThat(event.getLevel()).isEqualTo(Level.toLevel(expectedLevel));
                    assertThat(event.getFormattedMessage()).contains("kind=" + kind);
                });
    }

    @Test
    @DisplayName("Should refuse to start with an unknown default model")
    void testUnknownDefaultModel() {
        assertThatThrownBy(() -> new SearchService(client, new TestConfig("gpt-4", Duration.ofSeconds(5))))
                .isInstanceOf(DomainException.class)
                .satisfies(e -> assertThat(((DomainException) e).getKind()).isEqualTo(ErrorKind.CONFIGURATION_ERROR));
        verifyNoInteractions(client);
    }

    private static Logger serviceLogger() {
        return (Logger) LoggerFactory.getLogger(SearchService.class);
    }

    private static SearchResult result() {
        return new SearchResult("resp-1", "Answer", "sonar-reasoning", new Usage(1, 2, 3),
                List.of(), List.of(), NOW);
    }

    private record TestConfig(String defaultModel, Duration requestTimeout) implements ConfigProvider {

        @Override
        public String apiKey() {
            return "test-key";
        }

        @Override
        public String logLevel() {
            return "info";
        }
    }
}
