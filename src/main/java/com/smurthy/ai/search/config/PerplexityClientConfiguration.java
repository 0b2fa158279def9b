package com.smurthy.ai.search.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.smurthy.ai.search.domain.PerplexityClient;
import com.smurthy.ai.search.perplexity.PerplexityApiClient;
import okhttp3.ConnectionSpec;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import okhttp3.TlsVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;

/**
 * Upstream HTTP client wiring.
 *
 * The OkHttp client only negotiates TLS 1.2 or 1.3 and refuses cleartext.
 * Upstream calls run on its dispatcher, so the per-host limit bounds how
 * many searches can be in flight at once.
 */
@Configuration
public class PerplexityClientConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PerplexityClientConfiguration.class);

    static final ConnectionSpec TLS_12_OR_NEWER = new ConnectionSpec.Builder(ConnectionSpec.MODERN_TLS)
            .tlsVersions(TlsVersion.TLS_1_3, TlsVersion.TLS_1_2)
            .build();

    static final int MAX_CONCURRENT_REQUESTS = 64;

    @Bean
    public OkHttpClient perplexityHttpClient(PerplexityProperties properties) {
        return secureHttpClient(properties.requestTimeout());
    }

    @Bean
    public PerplexityClient perplexityClient(OkHttpClient perplexityHttpClient,
                                             ObjectMapper objectMapper,
                                             PerplexityProperties properties) {
        properties.validate();
        log.info("Perplexity client configured: {}", properties);
        return new PerplexityApiClient(
                perplexityHttpClient,
                objectMapper,
                properties.baseUrl(),
                properties.apiKey(),
                properties.resolvedDefaultModel(),
                properties.requestTimeout());
    }

    static OkHttpClient secureHttpClient(Duration timeout) {
        Dispatcher dispatcher = new Dispatcher();
        dispatcher.setMaxRequests(MAX_CONCURRENT_REQUESTS);
        dispatcher.setMaxRequestsPerHost(MAX_CONCURRENT_REQUESTS);
        return new OkHttpClient.Builder()
                .dispatcher(dispatcher)
                .connectionSpecs(List.of(TLS_12_OR_NEWER))
                .callTimeout(timeout)
                .build();
    }
}
