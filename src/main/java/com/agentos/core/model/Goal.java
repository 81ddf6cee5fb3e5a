package com.agentos.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * An externally sourced objective to be decomposed into tasks.
 *
 * @param id              unique id assigned at ingestion, never changes
 * @param teamId          team that owns the goal
 * @param description     free-text description (raw input before parsing)
 * @param successCriteria ordered list of measurable outcomes
 * @param context         optional background, may be {@code null}
 * @param priority        goal priority
 * @param status          lifecycle status
 * @param createdBy       author
 * @param createdAt       creation timestamp
 * @param source          name of the goal source that produced the goal
 * @param metadata        arbitrary metadata bag
 */
public record Goal(
    String id,
    String teamId,
    String description,
    List<String> successCriteria,
    String context,
    Priority priority,
    GoalStatus status,
    String createdBy,
    Instant createdAt,
    String source,
    Map<String, String> metadata
) {
    public Goal {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Goal id must not be blank");
        }
        successCriteria = successCriteria == null ? List.of() : List.copyOf(successCriteria);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        if (priority == null) {
            priority = Priority.MEDIUM;
        }
        if (status == null) {
            status = GoalStatus.PENDING;
        }
    }

    /**
     * Returns a copy in the given status.
     *
     * @throws IllegalStateException if the move would go backwards in the goal status flow
     */
    public Goal withStatus(GoalStatus next) {
        if (next == status) {
            return this;
        }
        if (!status.canAdvanceTo(next)) {
            throw new IllegalStateException("Goal " + id + " cannot move " + status + " -> " + next);
        }
        return new Goal(id, teamId, description, successCriteria, context, priority, next,
                createdBy, createdAt, source, metadata);
    }
}
