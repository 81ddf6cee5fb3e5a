package com.agentos.core.llm;

import java.time.Duration;

/**
 * A single attempt exceeded its stage timeout. Retryable.
 */
public class LlmTimeoutException extends RuntimeException {

    public LlmTimeoutException(PipelineStage stage, String modelAlias, Duration timeout) {
        super("Stage " + stage.configKey() + " timed out after " + timeout.toMillis() + "ms on model " + modelAlias);
    }
}
