package com.smurthy.ai.search.validation;

import com.smurthy.ai.search.domain.DateRange;
import com.smurthy.ai.search.domain.DomainException;
import com.smurthy.ai.search.domain.ErrorKind;
import com.smurthy.ai.search.domain.SearchMode;
import com.smurthy.ai.search.domain.SearchModel;
import com.smurthy.ai.search.domain.SearchRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.smurthy.ai.search.domain.SearchRequest.MAX_OPTIONS_COUNT;
import static com.smurthy.ai.search.domain.SearchRequest.MAX_OPTION_KEY_LENGTH;
import static com.smurthy.ai.search.domain.SearchRequest.MAX_OPTION_VALUE_LENGTH;
import static com.smurthy.ai.search.domain.SearchRequest.MAX_QUERY_LENGTH;
import static com.smurthy.ai.search.domain.SearchRequest.MAX_SOURCES_COUNT;
import static com.smurthy.ai.search.domain.SearchRequest.MAX_TOKENS;

/**
 * Turns the untyped argument map of a tool call into a {@link SearchRequest}.
 *
 * Fields are checked in a fixed order and the first violation is thrown as
 * an {@code INVALID_REQUEST} error; nothing is built until every field has
 * passed. The validator keeps no state and is safe to share between
 * threads.
 *
 * Argument keys follow the tool's input schema:
 * - query (string, required)
 * - model, search_mode, date_range (string enums, empty means unset)
 * - max_tokens (number)
 * - sources (array of strings)
 * - options (object of string values)
 */
@Component
public class SearchRequestValidator {

    public SearchRequest validate(Map<String, Object> args) {
        Map<String, Object> raw = args == null ? Map.of() : args;

        String query = validateQuery(raw.get("query"));
        SearchModel model = validateModel(raw.get("model"));
        SearchMode searchMode = validateSearchMode(raw.get("search_mode"));
        int maxTokens = validateMaxTokens(raw.get("max_tokens"));
        DateRange dateRange = validateDateRange(raw.get("date_range"));
        List<String> sources = validateSources(raw.get("sources"));
        Map<String, String> options = validateOptions(raw.get("options"));

        return new SearchRequest(query, model, searchMode, dateRange, maxTokens, sources, options);
    }

    private String validateQuery(Object value) {
        if (!(value instanceof String text)) {
            throw invalid("query must be a string");
        }
        String query = trimSpace(text);
        if (query.isEmpty()) {
            throw invalid("query must not be blank");
        }
        int length = query.codePointCount(0, query.length());
        if (length > MAX_QUERY_LENGTH) {
            throw invalid(String.format("query length %d exceeds maximum %d", length, MAX_QUERY_LENGTH));
        }
        return query;
    }

    /**
     * Strips leading and trailing Unicode whitespace, including the
     * no-break spaces (U+00A0, U+2007, U+202F) and NEL that
     * {@link String#strip()} keeps.
     */
    private static String trimSpace(String text) {
        int start = 0;
        int end = text.length();
        while (start < end) {
            int cp = text.codePointAt(start);
            if (!isSpace(cp)) {
                break;
            }
            start += Character.charCount(cp);
        }
        while (end > start) {
            int cp = text.codePointBefore(end);
            if (!isSpace(cp)) {
                break;
            }
            end -= Character.charCount(cp);
        }
        return text.substring(start, end);
    }

    private static boolean isSpace(int cp) {
        return Character.isWhitespace(cp) || Character.isSpaceChar(cp) || cp == 0x85;
    }

    private SearchModel validateModel(Object value) {
        String id = optionalString("model", value);
        if (id.isEmpty()) {
            return null;
        }
        return SearchModel.fromId(id).orElseThrow(() -> invalid(String.format(
                "invalid model '%s', must be one of: %s", id, String.join(", ", SearchModel.ids()))));
    }

    private SearchMode validateSearchMode(Object value) {
        String mode = optionalString("search_mode", value);
        if (mode.isEmpty()) {
            return null;
        }
        return SearchMode.fromValue(mode).orElseThrow(() -> invalid(String.format(
                "invalid search_mode '%s', must be one of: %s", mode, String.join(", ", SearchMode.allValues()))));
    }

    private DateRange validateDateRange(Object value) {
        String range = optionalString("date_range", value);
        if (range.isEmpty()) {
            return null;
        }
        return DateRange.fromValue(range).orElseThrow(() -> invalid(String.format(
                "invalid date_range '%s', must be one of: %s", range, String.join(", ", DateRange.allValues()))));
    }

    private int validateMaxTokens(Object value) {
        if (value == null) {
            return 0;
        }
        if (!(value instanceof Number number)) {
            throw invalid("max_tokens must be a number");
        }
        double tokens = number.doubleValue();
        if (Double.isNaN(tokens) || tokens < 0) {
            throw invalid("max_tokens cannot be negative");
        }
        if (tokens > MAX_TOKENS) {
            throw invalid(String.format("max_tokens %s exceeds maximum %d", number, MAX_TOKENS));
        }
        return (int) tokens;
    }

    private List<String> validateSources(Object value) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw invalid("sources must be an array");
        }
        if (list.size() > MAX_SOURCES_COUNT) {
            throw invalid(String.format("sources count %d exceeds maximum %d", list.size(), MAX_SOURCES_COUNT));
        }
        Set<String> sources = new LinkedHashSet<>();
        for (int i = 0; i < list.size(); i++) {
            if (!(list.get(i) instanceof String source)) {
                throw invalid(String.format("source[%d] must be a string", i));
            }
            sources.add(source);
        }
        return new ArrayList<>(sources);
    }

    private Map<String, String> validateOptions(Object value) {
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map<?, ?> map)) {
            throw invalid("options must be an object");
        }
        if (map.size() > MAX_OPTIONS_COUNT) {
            throw invalid(String.format("options count %d exceeds maximum %d", map.size(), MAX_OPTIONS_COUNT));
        }
        Map<String, String> options = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (key.length() > MAX_OPTION_KEY_LENGTH) {
                throw invalid(String.format("option key length %d exceeds maximum %d",
                        key.length(), MAX_OPTION_KEY_LENGTH));
            }
            if (!(entry.getValue() instanceof String optionValue)) {
                throw invalid(String.format("option '%s' must be a string", key));
            }
            if (optionValue.length() > MAX_OPTION_VALUE_LENGTH) {
                throw invalid(String.format("option value length %d exceeds maximum %d",
                        optionValue.length(), MAX_OPTION_VALUE_LENGTH));
            }
            options.put(key, optionValue);
        }
        return options;
    }

    private String optionalString(String field, Object value) {
        if (value == null) {
            return "";
        }
        if (!(value instanceof String text)) {
            throw invalid(field + " must be a string");
        }
        return text;
    }

    private static DomainException invalid(String detail) {
        return new DomainException(ErrorKind.INVALID_REQUEST, detail);
    }
}
