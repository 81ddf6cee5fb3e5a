package com.agentos.core.llm;

/**
 * Price per 1,000 tokens, in the configured currency.
 */
public record ModelPricing(double inputPer1k, double outputPer1k) {

    public static final ModelPricing FREE = new ModelPricing(0.0, 0.0);

    public double estimateCost(long inputTokens, long outputTokens) {
        return (inputTokens / 1000.0) * inputPer1k + (outputTokens / 1000.0) * outputPer1k;
    }
}
