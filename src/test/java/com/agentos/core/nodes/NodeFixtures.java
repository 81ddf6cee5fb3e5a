package com.agentos.core.nodes;

import com.agentos.core.llm.LlmResponse;
import com.agentos.core.llm.TokenUsage;
import com.agentos.core.model.Goal;
import com.agentos.core.model.GoalStatus;
import com.agentos.core.model.Priority;

import java.time.Instant;
import java.util.List;
import java.util.Map;

final class NodeFixtures {

    static final Instant CREATED = Instant.parse("2026-02-01T09:00:00Z");

    private NodeFixtures() {}

    static Goal goal(String id) {
        return new Goal(id, "core", "Publish a benchmark report", List.of("report is published"), null,
                Priority.HIGH, GoalStatus.PENDING, "alice", CREATED, "filesystem", Map.of());
    }

    static LlmResponse response(String json) {
        return new LlmResponse(json, new TokenUsage(120, 80), "test-model", 1);
    }
}
