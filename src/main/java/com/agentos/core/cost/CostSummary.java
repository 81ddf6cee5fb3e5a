package com.agentos.core.cost;

import java.util.Map;

/**
 * Aggregated spend, keyed by stage config key and by model alias.
 */
public record CostSummary(
    double total,
    long calls,
    long inputTokens,
    long outputTokens,
    Map<String, Double> byStage,
    Map<String, Double> byModel
) {}
