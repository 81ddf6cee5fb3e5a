package com.agentos.core.llm;

public record TokenUsage(long promptTokens, long completionTokens) {

    public static final TokenUsage EMPTY = new TokenUsage(0, 0);

    public long totalTokens() {
        return promptTokens + completionTokens;
    }
}
