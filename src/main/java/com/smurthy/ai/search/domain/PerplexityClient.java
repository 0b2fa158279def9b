package com.smurthy.ai.search.domain;

/**
 * Port to the upstream search API.
 *
 * Implementations hold no per-call state and are shared across concurrent
 * calls.
 */
public interface PerplexityClient {

    /**
     * Runs one search.
     *
     * @throws DomainException with kind {@code INVALID_REQUEST}, {@code AUTH_ERROR},
     *         {@code RATE_LIMITED}, {@code API_ERROR}, {@code NETWORK_ERROR} or {@code TIMEOUT_ERROR}
     */
    SearchResult search(CallContext ctx, SearchRequest request);
}
