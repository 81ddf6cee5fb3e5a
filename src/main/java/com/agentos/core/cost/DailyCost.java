package com.agentos.core.cost;

import java.time.LocalDate;

/**
 * Spend of one UTC day for one stage and model.
 */
public record DailyCost(
    LocalDate date,
    String stage,
    String modelAlias,
    long inputTokens,
    long outputTokens,
    double cost
) {

    DailyCost plus(DailyCost other) {
        return new DailyCost(date, stage, modelAlias, inputTokens + other.inputTokens,
                outputTokens + other.outputTokens, cost + other.cost);
    }
}
