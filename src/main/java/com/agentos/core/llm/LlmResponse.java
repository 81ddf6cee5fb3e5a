package com.agentos.core.llm;

/**
 * Normalized result of {@link LlmService#generate}.
 *
 * @param text       response text exactly as the model returned it
 * @param usage      token counters reported by the provider
 * @param modelAlias alias of the model that produced the text
 * @param attempts   total attempts made across all candidate models
 */
public record LlmResponse(
    String text,
    TokenUsage usage,
    String modelAlias,
    int attempts
) {}
