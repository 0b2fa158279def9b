package com.smurthy.ai.search.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Sonar models accepted by the upstream search API.
 */
public enum SearchModel {

    SONAR("sonar"),
    SONAR_PRO("sonar-pro"),
    SONAR_REASONING("sonar-reasoning"),
    SONAR_REASONING_PRO("sonar-reasoning-pro"),
    SONAR_DEEP_RESEARCH("sonar-deep-research");

    private final String id;

    SearchModel(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<SearchModel> fromId(String id) {
        return Arrays.stream(values())
                .filter(model -> model.id.equals(id))
                .findFirst();
    }

    public static List<String> ids() {
        return Arrays.stream(values()).map(SearchModel::id).toList();
    }
}
