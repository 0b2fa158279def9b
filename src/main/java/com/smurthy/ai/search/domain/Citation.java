package com.smurthy.ai.search.domain;

public record Citation(int number, String url, String title) {
}
