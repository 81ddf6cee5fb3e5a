package com.agentos.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the goal pipeline.
 */
@Service
public class AgentOsMetrics {

    private final MeterRegistry registry;

    public AgentOsMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordLlmCall(String stage, String model, long ms, boolean success) {
        Timer.builder("agentos.llm.call.duration")
                .tag("stage", stage)
                .tag("model", model)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordAttemptFailure(String stage, String model, String errorType) {
        Counter.builder("agentos.llm.attempt.failures")
                .tag("stage", stage)
                .tag("model", model)
                .tag("error", errorType)
                .register(registry)
                .increment();
    }

    public void recordFallback(String stage, String fromModel, String toModel) {
        Counter.builder("agentos.llm.fallbacks")
                .tag("stage", stage)
                .tag("from", fromModel)
                .tag("to", toModel)
                .register(registry)
                .increment();
    }

    public void recordCost(String stage, String model, double cost) {
        DistributionSummary.builder("agentos.llm.cost")
                .description("Estimated cost per call")
                .tag("stage", stage)
                .tag("model", model)
                .register(registry)
                .record(cost);
    }

    public void recordTaskOutcome(String status) {
        Counter.builder("agentos.tasks.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordTaskExecution(String taskType, long ms) {
        Timer.builder("agentos.task.duration")
                .tag("type", taskType != null ? taskType : "unknown")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordGoalResult(String status) {
        Counter.builder("agentos.goals.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordCycle(int goalCount) {
        Counter.builder("agentos.cycles.total")
                .register(registry)
                .increment();
        DistributionSummary.builder("agentos.cycle.goals")
                .description("Goals polled per cycle")
                .register(registry)
                .record(goalCount);
    }
}
