package com.agentos.core.source;

import com.agentos.core.model.Goal;

import java.util.List;

/**
 * External store that supplies goals and receives status.
 * <p>
 * The core treats every call as opaque I/O with no retry of its own.
 */
public interface GoalSource {

    /**
     * Goals in a pending state for the given team, or for every team when {@code teamId} is null.
     */
    List<Goal> pollGoals(String teamId);

    /**
     * Atomically claims a task or goal id. First caller wins; later callers get {@code false}.
     */
    boolean claim(String id, String workerId);

    /**
     * Records a status change. Fire-and-forget from the caller's perspective.
     */
    void report(String id, String status, String message, ReportContext context);

    void requestClarification(String goalId, String questionText);

    void notify(String message);
}
