package com.agentos.core.scheduler;

import com.agentos.core.model.GoalStatus;

import java.util.Set;

/**
 * Outcome of running one goal's task batch.
 *
 * @param completed  ids of completed tasks
 * @param failed     ids of failed tasks
 * @param blocked    ids of blocked tasks
 * @param goalStatus derived goal status: failed if any task failed, else blocked if any
 *                   task is blocked, else completed
 */
public record SchedulingResult(
    Set<String> completed,
    Set<String> failed,
    Set<String> blocked,
    GoalStatus goalStatus
) {
    public SchedulingResult {
        completed = Set.copyOf(completed);
        failed = Set.copyOf(failed);
        blocked = Set.copyOf(blocked);
    }

    public int completedCount() {
        return completed.size();
    }

    public int failedCount() {
        return failed.size();
    }

    public int blockedCount() {
        return blocked.size();
    }

    static GoalStatus deriveStatus(Set<String> failed, Set<String> blocked) {
        if (!failed.isEmpty()) {
            return GoalStatus.FAILED;
        }
        if (!blocked.isEmpty()) {
            return GoalStatus.BLOCKED;
        }
        return GoalStatus.COMPLETED;
    }
}
