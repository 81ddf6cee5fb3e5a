package com.agentos.core.model;

import java.util.List;

/**
 * Produced once per task on successful completion.
 */
public record TaskResult(
    String summary,
    List<Artifact> artifacts,
    TaskMetrics metrics
) {
    public TaskResult {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }
}
