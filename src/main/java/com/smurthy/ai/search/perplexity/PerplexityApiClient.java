package com.smurthy.ai.search.perplexity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.smurthy.ai.search.domain.CallContext;
import com.smurthy.ai.search.domain.Cancellation;
import com.smurthy.ai.search.domain.DomainException;
import com.smurthy.ai.search.domain.ErrorKind;
import com.smurthy.ai.search.domain.PerplexityClient;
import com.smurthy.ai.search.domain.SearchModel;
import com.smurthy.ai.search.domain.SearchRequest;
import com.smurthy.ai.search.domain.SearchResult;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Perplexity chat-completions API client.
 *
 * One instance is shared by all calls; it keeps no per-call state. Each
 * call gets its own OkHttp call timeout derived from the caller's
 * deadline, or from the configured timeout when the caller set none.
 * Cancelling the caller's context or interrupting the calling thread
 * cancels the in-flight OkHttp call.
 *
 * Response bodies are read through a hard cap of {@link #MAX_RESPONSE_SIZE}
 * bytes. A body that reaches the cap is rejected, never truncated.
 *
 * Upstream response bodies are never logged.
 *
 * API Docs: https://docs.perplexity.ai
 */
public class PerplexityApiClient implements PerplexityClient {

    private static final Logger log = LoggerFactory.getLogger(PerplexityApiClient.class);

    public static final String DEFAULT_BASE_URL = "https://api.perplexity.ai";
    public static final String CHAT_COMPLETIONS_ENDPOINT = "/chat/completions";
    public static final int MAX_RESPONSE_SIZE = 10 * 1024 * 1024;

    private static final MediaType JSON = MediaType.get("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ChatRequestMapper requestMapper;
    private final SearchResultMapper resultMapper;
    private final String baseUrl;
    private final String apiKey;
    private final SearchModel defaultModel;
    private final Duration defaultTimeout;

    public PerplexityApiClient(OkHttpClient httpClient,
                               ObjectMapper objectMapper,
                               String baseUrl,
                               String apiKey,
                               SearchModel defaultModel,
                               Duration defaultTimeout) {
        this(httpClient, objectMapper, new ChatRequestMapper(), new SearchResultMapper(),
                baseUrl, apiKey, defaultModel, defaultTimeout);
    }

    public PerplexityApiClient(OkHttpClient httpClient,
                               ObjectMapper objectMapper,
                               ChatRequestMapper requestMapper,
                               SearchResultMapper resultMapper,
                               String baseUrl,
                               String apiKey,
                               SearchModel defaultModel,
                               Duration defaultTimeout) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new DomainException(ErrorKind.CONFIGURATION_ERROR, "perplexity API key not configured");
        }
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.requestMapper = requestMapper;
        this.resultMapper = resultMapper;
        this.baseUrl = stripTrailingSlash(baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl);
        this.apiKey = apiKey;
        this.defaultModel = defaultModel == null ? SearchModel.SONAR : defaultModel;
        this.defaultTimeout = defaultTimeout;
    }

    @Override
    public SearchResult search(CallContext ctx, SearchRequest request) {
        SearchRequest effective = request.hasModel() ? request : request.withModel(defaultModel);

        ChatCompletion.Request apiRequest = requestMapper.toApiRequest(effective);
        ChatCompletion.Response apiResponse = execute(ctx.withDefaultTimeout(defaultTimeout), apiRequest);
        SearchResult result = resultMapper.toSearchResult(apiResponse);

        log.debug("Search completed: id={}, tokens={}", result.id(), result.usage().totalTokens());
        return result;
    }

    private ChatCompletion.Response execute(CallContext ctx, ChatCompletion.Request apiRequest) {
        byte[] payload;
        try {
            payload = objectMapper.writeValueAsBytes(apiRequest);
        } catch (JsonProcessingException e) {
            throw new DomainException(ErrorKind.INVALID_REQUEST, "failed to marshal request: " + e.getOriginalMessage(), e);
        }

        String url = baseUrl + CHAT_COMPLETIONS_ENDPOINT;
        Request httpRequest = new Request.Builder()
                .url(url)
                .header("Authorization", "Bearer " + apiKey)
                .header("Accept", "application/json")
                .post(RequestBody.create(payload, JSON))
                .build();

        if (ctx.isCancelled()) {
            throw new DomainException(ErrorKind.NETWORK_ERROR, "request cancelled before it was sent");
        }
        Duration budget = ctx.remaining().orElse(defaultTimeout);
        // OkHttp treats a zero call timeout as "no timeout"
        if (budget.toMillis() <= 0) {
            throw new DomainException(ErrorKind.TIMEOUT_ERROR, "deadline exceeded before request was sent");
        }
        OkHttpClient callClient = httpClient.newBuilder()
                .callTimeout(budget)
                .build();

        log.debug("Calling Perplexity API: url={}, model={}, messages={}, budgetMs={}",
                url, apiRequest.model(), apiRequest.messages().size(), budget.toMillis());

        Call call = callClient.newCall(httpRequest);
        CompletableFuture<RawResponse> pending = new CompletableFuture<>();
        call.enqueue(new Callback() {
            @Override
            public void onFailure(Call failed, IOException e) {
                pending.completeExceptionally(e);
            }

            @Override
            public void onResponse(Call completed, Response response) {
                try (response) {
                    pending.complete(new RawResponse(response.code(), readBounded(response.body())));
                } catch (IOException | RuntimeException e) {
                    pending.completeExceptionally(e);
                }
            }
        });

        RawResponse raw = await(ctx, call, pending);
        if (raw.statusCode() < 200 || raw.statusCode() >= 300) {
            throw mapErrorResponse(raw.statusCode(), raw.body());
        }
        return parse(raw.body());
    }

    /**
     * Blocks until the call completes, the context is cancelled or the
     * calling thread is interrupted. Cancellation and interruption both
     * cancel the OkHttp call.
     */
    private RawResponse await(CallContext ctx, Call call, CompletableFuture<RawResponse> pending) {
        Runnable abort = () -> {
            call.cancel();
            pending.completeExceptionally(new IOException("Canceled"));
        };
        try (Cancellation.Registration ignored = ctx.onCancel(abort)) {
            return pending.get();
        } catch (InterruptedException e) {
            call.cancel();
            Thread.currentThread().interrupt();
            log.warn("Perplexity call interrupted");
            if (ctx.isExpired()) {
                throw new DomainException(ErrorKind.TIMEOUT_ERROR, "request timed out", e);
            }
            throw new DomainException(ErrorKind.NETWORK_ERROR, "request interrupted", e);
        } catch (ExecutionException e) {
            throw mapFailure(ctx, e.getCause());
        }
    }

    private RuntimeException mapFailure(CallContext ctx, Throwable failure) {
        if (failure instanceof DomainException domain) {
            return domain;
        }
        if (!(failure instanceof IOException io)) {
            return new DomainException(ErrorKind.API_ERROR, "unexpected failure reading response", failure);
        }
        if (ctx.isExpired()) {
            return new DomainException(ErrorKind.TIMEOUT_ERROR, "request timed out", io);
        }
        if (ctx.isCancelled()) {
            log.info("Perplexity call cancelled");
            return new DomainException(ErrorKind.NETWORK_ERROR, "request cancelled", io);
        }
        if (io instanceof InterruptedIOException) {
            return new DomainException(ErrorKind.TIMEOUT_ERROR, "request timed out", io);
        }
        return new DomainException(ErrorKind.NETWORK_ERROR, "request failed: " + io.getMessage(), io);
    }

    private byte[] readBounded(ResponseBody body) throws IOException {
        if (body == null) {
            return new byte[0];
        }
        try (InputStream in = body.byteStream()) {
            byte[] bytes = in.readNBytes(MAX_RESPONSE_SIZE);
            if (bytes.length >= MAX_RESPONSE_SIZE) {
                log.warn("Response body reached size limit of {} bytes, rejecting", MAX_RESPONSE_SIZE);
                throw new DomainException(ErrorKind.API_ERROR,
                        String.format("response too large (exceeded %d bytes)", MAX_RESPONSE_SIZE));
            }
            return bytes;
        }
    }

    private ChatCompletion.Response parse(byte[] body) {
        try {
            return objectMapper.readValue(body, ChatCompletion.Response.class);
        } catch (IOException e) {
            throw new DomainException(ErrorKind.API_ERROR, "failed to parse response", e);
        }
    }

    DomainException mapErrorResponse(int statusCode, byte[] body) {
        ChatCompletion.ErrorEnvelope envelope = parseErrorEnvelope(body);
        if (envelope != null && envelope.isStructured()) {
            log.error("Perplexity API error: status={}, type=structured", statusCode);
            return mapStructuredError(statusCode, envelope.error().message());
        }
        log.error("Perplexity HTTP error: status={}, bodyLength={}", statusCode, body.length);
        return mapStatusCode(statusCode);
    }

    private ChatCompletion.ErrorEnvelope parseErrorEnvelope(byte[] body) {
        if (body.length == 0) {
            return null;
        }
        try {
            return objectMapper.readValue(body, ChatCompletion.ErrorEnvelope.class);
        } catch (IOException e) {
            log.debug("Error body is not a structured error envelope");
            return null;
        }
    }

    private static DomainException mapStructuredError(int statusCode, String message) {
        if (statusCode == 400) {
            return new DomainException(ErrorKind.INVALID_REQUEST, message);
        }
        if (statusCode == 401) {
            return new DomainException(ErrorKind.AUTH_ERROR, message);
        }
        if (statusCode == 429) {
            return new DomainException(ErrorKind.RATE_LIMITED, message);
        }
        if (statusCode >= 500 && statusCode < 600) {
            return new DomainException(ErrorKind.API_ERROR, String.format("server error (HTTP %d): %s", statusCode, message));
        }
        return new DomainException(ErrorKind.API_ERROR, String.format("HTTP %d: %s", statusCode, message));
    }

    private static DomainException mapStatusCode(int statusCode) {
        if (statusCode == 400) {
            return new DomainException(ErrorKind.INVALID_REQUEST, "bad request");
        }
        if (statusCode == 401) {
            return new DomainException(ErrorKind.AUTH_ERROR, "unauthorized");
        }
        if (statusCode == 429) {
            return new DomainException(ErrorKind.RATE_LIMITED, "rate limited");
        }
        if (statusCode >= 500 && statusCode < 600) {
            return new DomainException(ErrorKind.API_ERROR, String.format("server error (HTTP %d)", statusCode));
        }
        return new DomainException(ErrorKind.API_ERROR, String.format("HTTP %d", statusCode));
    }

    private record RawResponse(int statusCode, byte[] body) {
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
