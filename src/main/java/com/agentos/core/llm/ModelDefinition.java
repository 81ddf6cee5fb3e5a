package com.agentos.core.llm;

/**
 * Static description of a configured model alias.
 */
public record ModelDefinition(
    String alias,
    String provider,
    String modelId,
    String baseUrl,
    ModelPricing pricing
) {}
