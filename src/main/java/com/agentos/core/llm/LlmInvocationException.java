package com.agentos.core.llm;

/**
 * Thrown when every model and retry combination for a stage has failed.
 * The cause is the last error observed and the message is taken from it unchanged.
 */
public class LlmInvocationException extends RuntimeException {

    private final PipelineStage stage;
    private final int attempts;

    public LlmInvocationException(PipelineStage stage, int attempts, Throwable lastError) {
        super(lastError.getMessage() != null ? lastError.getMessage() : lastError.getClass().getSimpleName(),
                lastError);
        this.stage = stage;
        this.attempts = attempts;
    }

    public PipelineStage getStage() {
        return stage;
    }

    public int getAttempts() {
        return attempts;
    }
}
