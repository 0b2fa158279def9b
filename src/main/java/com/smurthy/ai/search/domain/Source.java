package com.smurthy.ai.search.domain;

public record Source(String url, String title, String snippet) {
}
