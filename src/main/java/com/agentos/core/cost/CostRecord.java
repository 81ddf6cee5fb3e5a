package com.agentos.core.cost;

import com.agentos.core.llm.PipelineStage;

import java.time.Instant;

/**
 * One successful model call and its estimated cost.
 */
public record CostRecord(
    Instant timestamp,
    PipelineStage stage,
    String modelAlias,
    long inputTokens,
    long outputTokens,
    double cost
) {}
