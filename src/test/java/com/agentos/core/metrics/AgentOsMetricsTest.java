package com.agentos.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AgentOsMetricsTest {

    private SimpleMeterRegistry registry;
    private AgentOsMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new AgentOsMetrics(registry);
    }

    @Test
    @DisplayName("task and goal outcomes are counted per status")
    void outcomes() {
        metrics.recordTaskOutcome("completed");
        metrics.recordTaskOutcome("completed");
        metrics.recordTaskOutcome("blocked");
        metrics.recordGoalResult("failed");

        assertEquals(2.0, registry.get("agentos.tasks.total").tag("status", "completed").counter().count());
        assertEquals(1.0, registry.get("agentos.tasks.total").tag("status", "blocked").counter().count());
        assertEquals(1.0, registry.get("agentos.goals.total").tag("status", "failed").counter().count());
    }

    @Test
    @DisplayName("model calls record duration, failures, fallbacks and cost")
    void llmCalls() {
        metrics.recordLlmCall("parse", "kimi", 1500, true);
        metrics.recordAttemptFailure("parse", "kimi", "LlmTimeoutException");
        metrics.recordFallback("parse", "kimi", "mini");
        metrics.recordCost("parse", "mini", 0.25);

        var timer = registry.get("agentos.llm.call.duration").tags("stage", "parse", "outcome", "success").timer();
        assertEquals(1, timer.count());
        assertEquals(1500.0, timer.totalTime(TimeUnit.MILLISECONDS));
        assertEquals(1.0, registry.get("agentos.llm.attempt.failures").tag("error", "LlmTimeoutException")
                .counter().count());
        assertEquals(1.0, registry.get("agentos.llm.fallbacks").tags("from", "kimi", "to", "mini")
                .counter().count());
        assertEquals(0.25, registry.get("agentos.llm.cost").tag("model", "mini").summary().totalAmount());
    }

    @Test
    @DisplayName("a task without type is timed as unknown")
    void unknownType() {
        metrics.recordTaskExecution(null, 10);
        assertEquals(1, registry.get("agentos.task.duration").tag("type", "unknown").timer().count());
    }

    @Test
    @DisplayName("cycles count polls and goal volume")
    void cycles() {
        metrics.recordCycle(3);
        metrics.recordCycle(0);

        assertEquals(2.0, registry.get("agentos.cycles.total").counter().count());
        assertEquals(3.0, registry.get("agentos.cycle.goals").summary().totalAmount());
    }
}
