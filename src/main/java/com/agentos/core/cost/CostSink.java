package com.agentos.core.cost;

import com.agentos.core.llm.ModelPricing;
import com.agentos.core.llm.PipelineStage;

/**
 * Receives usage records for every successful model call.
 */
public interface CostSink {

    void logCall(PipelineStage stage, String modelAlias, long inputTokens, long outputTokens, ModelPricing pricing);
}
