package com.smurthy.ai.search.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Recency window applied to search results.
 */
public enum DateRange {

    DAY("day"),
    WEEK("week"),
    MONTH("month"),
    YEAR("year");

    private final String value;

    DateRange(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<DateRange> fromValue(String value) {
        return Arrays.stream(values())
                .filter(range -> range.value.equals(value))
                .findFirst();
    }

    public static List<String> allValues() {
        return Arrays.stream(values()).map(DateRange::value).toList();
    }
}
