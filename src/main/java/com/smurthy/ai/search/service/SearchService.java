package com.smurthy.ai.search.service;

import com.smurthy.ai.search.domain.CallContext;
import com.smurthy.ai.search.domain.ConfigProvider;
import com.smurthy.ai.search.domain.DomainException;
import com.smurthy.ai.search.domain.ErrorKind;
import com.smurthy.ai.search.domain.PerplexityClient;
import com.smurthy.ai.search.domain.SearchModel;
import com.smurthy.ai.search.domain.SearchRequest;
import com.smurthy.ai.search.domain.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Search use case: resolves the model, bounds the call with the configured
 * request timeout and delegates to the upstream client.
 *
 * Upstream failures are logged by kind and propagated unchanged. Client
 * and transient errors log at WARN, everything else at ERROR.
 */
@Service
public class SearchService {

    private static final Logger log = LoggerFactory.getLogger(SearchService.class);

    private final PerplexityClient client;
    private final SearchModel defaultModel;
    private final Duration requestTimeout;

    public SearchService(PerplexityClient client, ConfigProvider config) {
        this.client = client;
        this.defaultModel = SearchModel.fromId(config.defaultModel())
                .orElseThrow(() -> new DomainException(ErrorKind.CONFIGURATION_ERROR,
                        "unknown default model '" + config.defaultModel() + "'"));
        this.requestTimeout = config.requestTimeout();
    }

    public SearchResult execute(CallContext ctx, SearchRequest request) {
        CallContext bounded = ctx.withDefaultTimeout(requestTimeout);

        SearchRequest effective = request;
        if (!request.hasModel()) {
            effective = request.withModel(defaultModel);
            log.debug("Applied default model {}", defaultModel.id());
        }

        log.info("Starting search: model={}, searchMode={}, dateRange={}, queryLength={}, sources={}",
                effective.model().id(),
                effective.searchMode() == null ? "-" : effective.searchMode().value(),
                effective.dateRange() == null ? "-" : effective.dateRange().value(),
                effective.query().length(),
                effective.sources().size());

        SearchResult result;
        try {
            result = client.search(bounded, effective);
        } catch (DomainException e) {
            logFailure(e, effective);
            throw e;
        }

        log.info("Search completed: id={}, model={}, totalTokens={}, citations={}, sources={}",
                result.id(), result.model(), result.usage().totalTokens(),
                result.citations().size(), result.sources().size());
        return result;
    }

    private void logFailure(DomainException e, SearchRequest request) {
        ErrorKind kind = e.getKind();
        if (kind.isClientError() || kind.isTransient()) {
            log.warn("Search failed: kind={}, model={}, transient={}, message={}",
                    kind, request.model().id(), kind.isTransient(), e.getMessage());
        } else {
            log.error("Search failed: kind={}, model={}, message={}", kind, request.model().id(), e.getMessage());
        }
    }
}
