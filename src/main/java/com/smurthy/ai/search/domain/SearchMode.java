package com.smurthy.ai.search.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

public enum SearchMode {

    WEB("web"),
    ACADEMIC("academic"),
    NEWS("news");

    private final String value;

    SearchMode(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<SearchMode> fromValue(String value) {
        return Arrays.stream(values())
                .filter(mode -> mode.value.equals(value))
                .findFirst();
    }

    public static List<String> allValues() {
        return Arrays.stream(values()).map(SearchMode::value).toList();
    }
}
