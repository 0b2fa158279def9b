package com.smurthy.ai.search.config;

import com.smurthy.ai.search.domain.ConfigProvider;
import com.smurthy.ai.search.domain.DomainException;
import com.smurthy.ai.search.domain.ErrorKind;
import com.smurthy.ai.search.domain.SearchModel;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.Locale;
import java.util.Set;

/**
 * Perplexity settings, bound from the {@code perplexity.*} properties
 * (which map the PERPLEXITY_API_KEY, PERPLEXITY_DEFAULT_MODEL,
 * REQUEST_TIMEOUT_SECONDS and LOG_LEVEL environment variables in
 * application.yaml).
 */
@ConfigurationProperties(prefix = "perplexity")
public record PerplexityProperties(
        String apiKey,
        @DefaultValue("sonar") String defaultModel,
        @DefaultValue("30s") Duration requestTimeout,
        @DefaultValue("info") String logLevel,
        @DefaultValue("https://api.perplexity.ai") String baseUrl
) implements ConfigProvider {

    private static final Set<String> LOG_LEVELS = Set.of("debug", "info", "warn", "error");

    public PerplexityProperties {
        logLevel = logLevel == null ? "info" : logLevel.toLowerCase(Locale.ROOT);
    }

    /**
     * @throws DomainException with kind {@code CONFIGURATION_ERROR} on the first invalid setting
     */
    public void validate() {
        if (apiKey == null || apiKey.isBlank()) {
            throw new DomainException(ErrorKind.CONFIGURATION_ERROR, "PERPLEXITY_API_KEY environment variable is required");
        }
        if (defaultModel == null || SearchModel.fromId(defaultModel).isEmpty()) {
            throw new DomainException(ErrorKind.CONFIGURATION_ERROR, "invalid or empty model configuration: " + defaultModel);
        }
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new DomainException(ErrorKind.CONFIGURATION_ERROR, "request timeout must be greater than 0");
        }
        if (!LOG_LEVELS.contains(logLevel)) {
            throw new DomainException(ErrorKind.CONFIGURATION_ERROR, "log level must be one of: debug, info, warn, error");
        }
    }

    public SearchModel resolvedDefaultModel() {
        return SearchModel.fromId(defaultModel).orElse(SearchModel.SONAR);
    }

    @Override
    public String toString() {
        // omits apiKey
        return "PerplexityProperties[defaultModel=" + defaultModel + ", requestTimeout=" + requestTimeout
                + ", logLevel=" + logLevel + ", baseUrl=" + baseUrl + "]";
    }
}
