package com.agentos.core.model;

/**
 * Execution counters attached to a {@link TaskResult}.
 */
public record TaskMetrics(
    long durationMs,
    long promptTokens,
    long completionTokens
) {
    public long totalTokens() {
        return promptTokens + completionTokens;
    }
}
