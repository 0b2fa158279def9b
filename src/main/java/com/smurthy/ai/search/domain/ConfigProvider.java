package com.smurthy.ai.search.domain;

import java.time.Duration;

/**
 * Read-only view of the server settings consumed by the search path.
 */
public interface ConfigProvider {

    String apiKey();

    String defaultModel();

    Duration requestTimeout();

    String logLevel();
}
