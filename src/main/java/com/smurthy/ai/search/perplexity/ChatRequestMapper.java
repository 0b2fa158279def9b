package com.smurthy.ai.search.perplexity;

import com.smurthy.ai.search.domain.DomainException;
import com.smurthy.ai.search.domain.ErrorKind;
import com.smurthy.ai.search.domain.SearchMode;
import com.smurthy.ai.search.domain.SearchRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the upstream chat-completions body from a validated search request.
 *
 * Options policy:
 * - a recognized option whose value fails its own bound is dropped with a warning
 * - an unknown option key is ignored with a warning
 * - an option value longer than {@link SearchRequest#MAX_OPTION_VALUE_LENGTH} fails the whole request
 *
 * Options are applied after the typed fields, so {@code search_mode} and
 * {@code search_domain_filter} options override {@code searchMode} and {@code sources}.
 */
public class ChatRequestMapper {

    private static final Logger log = LoggerFactory.getLogger(ChatRequestMapper.class);

    static final int MAX_DOMAIN_LENGTH = 253;
    static final int MAX_FILTER_DOMAINS = SearchRequest.MAX_SOURCES_COUNT;

    private static final Set<String> TRUE_LITERALS = Set.of("1", "t", "T", "true", "TRUE", "True");
    private static final Set<String> FALSE_LITERALS = Set.of("0", "f", "F", "false", "FALSE", "False");

    /**
     * The request must already carry a model.
     */
    public ChatCompletion.Request toApiRequest(SearchRequest request) {
        if (!request.hasModel()) {
            throw new DomainException(ErrorKind.INVALID_REQUEST, "model must be resolved before mapping");
        }

        Builder builder = new Builder(request.model().id(), request.query());
        if (request.maxTokens() > 0) {
            builder.maxTokens = request.maxTokens();
        }
        if (request.searchMode() != null) {
            builder.searchMode = request.searchMode().value();
        }
        if (request.dateRange() != null) {
            builder.recencyFilter = request.dateRange().value();
        }
        if (!request.sources().isEmpty()) {
            builder.domainFilter = request.sources();
        }

        applyOptions(builder, request.options());
        return builder.build();
    }

    private void applyOptions(Builder builder, Map<String, String> options) {
        for (Map.Entry<String, String> option : options.entrySet()) {
            String key = option.getKey();
            String value = option.getValue();

            if (key.length() > SearchRequest.MAX_OPTION_KEY_LENGTH) {
                log.warn("Option key too long ({} > {}), skipping", key.length(), SearchRequest.MAX_OPTION_KEY_LENGTH);
                continue;
            }
            if (value.length() > SearchRequest.MAX_OPTION_VALUE_LENGTH) {
                throw new DomainException(ErrorKind.INVALID_REQUEST, String.format(
                        "option value for key '%s' is too long: %d > %d",
                        key, value.length(), SearchRequest.MAX_OPTION_VALUE_LENGTH));
            }

            switch (key.toLowerCase(Locale.ROOT)) {
                case "temperature" -> parseBounded(value, 0.0, 2.0)
                        .ifPresentOrElse(t -> builder.temperature = t,
                                () -> log.warn("Ignoring out-of-range temperature option"));
                case "top_p" -> parseBounded(value, 0.0, 1.0)
                        .ifPresentOrElse(p -> builder.topP = p,
                                () -> log.warn("Ignoring out-of-range top_p option"));
                case "disable_search" -> {
                    Boolean disable = parseBoolean(value);
                    if (disable != null) {
                        builder.disableSearch = disable;
                    } else {
                        log.warn("Ignoring non-boolean disable_search option");
                    }
                }
                case "search_domain_filter" -> applyDomainFilter(builder, value);
                case "search_mode" -> SearchMode.fromValue(value).ifPresentOrElse(
                        mode -> builder.searchMode = mode.value(),
                        () -> log.warn("Invalid search_mode option, ignoring. Valid modes: {}", SearchMode.allValues()));
                default -> log.warn("Unknown search option key '{}', ignoring", key);
            }
        }
    }

    private void applyDomainFilter(Builder builder, String value) {
        List<String> domains = new ArrayList<>();
        for (String part : value.split(",")) {
            String domain = part.trim();
            if (domain.isEmpty()) {
                continue;
            }
            if (domain.length() > MAX_DOMAIN_LENGTH) {
                log.warn("Domain too long ({} chars), skipping", domain.length());
                continue;
            }
            if (domain.contains("/") || domain.contains(" ")) {
                log.warn("Invalid domain format, skipping");
                continue;
            }
            domains.add(domain);
        }
        if (domains.size() > MAX_FILTER_DOMAINS) {
            log.warn("search_domain_filter lists {} domains (max {}), ignoring option", domains.size(), MAX_FILTER_DOMAINS);
            return;
        }
        if (!domains.isEmpty()) {
            builder.domainFilter = List.copyOf(domains);
        }
    }

    private static Optional<Double> parseBounded(String value, double min, double max) {
        try {
            double parsed = Double.parseDouble(value.trim());
            if (parsed >= min && parsed <= max) {
                return Optional.of(parsed);
            }
        } catch (NumberFormatException e) {
            log.debug("Option value is not a number: {}", e.getMessage());
        }
        return Optional.empty();
    }

    private static Boolean parseBoolean(String value) {
        if (TRUE_LITERALS.contains(value)) {
            return Boolean.TRUE;
        }
        if (FALSE_LITERALS.contains(value)) {
            return Boolean.FALSE;
        }
        return null;
    }

    private static final class Builder {
        private final String model;
        private final String query;
        private Integer maxTokens;
        private Double temperature;
        private Double topP;
        private String searchMode;
        private String recencyFilter;
        private List<String> domainFilter;
        private Boolean disableSearch;

        private Builder(String model, String query) {
            this.model = model;
            this.query = query;
        }

        private ChatCompletion.Request build() {
            return new ChatCompletion.Request(
                    model,
                    List.of(new ChatCompletion.Message(ChatCompletion.ROLE_USER, query)),
                    maxTokens,
                    temperature,
                    topP,
                    searchMode,
                    recencyFilter,
                    domainFilter,
                    disableSearch,
                    false
            );
        }
    }
}
