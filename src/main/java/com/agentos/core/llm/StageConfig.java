package com.agentos.core.llm;

import java.time.Duration;
import java.util.Map;

/**
 * Immutable invocation settings for one pipeline stage.
 *
 * @param primary      primary model alias; for the execute stage this is the default model
 * @param fallback     fallback alias, or {@code null}
 * @param timeout      per-attempt timeout
 * @param maxRetries   retries per model after the first attempt
 * @param modelsByType execute stage only: task type to model alias
 */
public record StageConfig(
    PipelineStage stage,
    String primary,
    String fallback,
    Duration timeout,
    int maxRetries,
    Map<String, String> modelsByType
) {
    public StageConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0 for stage " + stage);
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive for stage " + stage);
        }
        fallback = fallback == null || fallback.isBlank() ? null : fallback;
        modelsByType = modelsByType == null ? Map.of() : Map.copyOf(modelsByType);
    }

    public int attemptsPerModel() {
        return maxRetries + 1;
    }
}
