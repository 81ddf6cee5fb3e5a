package com.agentos.core.llm;

/**
 * A single generative model behind one alias. Implementations perform exactly one
 * call with no retry of their own; retry, fallback and timeout belong to {@link LlmService}.
 */
@FunctionalInterface
public interface ModelClient {

    ModelReply complete(String prompt);
}
