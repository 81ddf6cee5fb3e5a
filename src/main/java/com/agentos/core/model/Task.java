package com.agentos.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One unit of work derived from a goal.
 * <p>
 * Identity fields are fixed at construction. Status and timestamps are mutated by
 * {@link com.agentos.core.state.TaskStateMachine}; the scheduler records assignment,
 * result and block reason.
 */
public class Task {

    private final String id;
    private final String goalId;
    private final String teamId;
    private final String description;
    private final String type;
    private final Set<String> requiredCapabilities;
    private final Set<String> dependencies;
    private final String estimatedEffort;

    private TaskStatus status = TaskStatus.PENDING;
    private Instant claimedAt;
    private Instant completedAt;
    private TaskResult result;
    private String assignedWorkerId;
    private BlockReason blockReason;

    public Task(String id, String goalId, String teamId, String description, String type,
                Set<String> requiredCapabilities, Set<String> dependencies, String estimatedEffort) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task id must not be blank");
        }
        this.id = id;
        this.goalId = goalId;
        this.teamId = teamId;
        this.description = description;
        this.type = type;
        this.requiredCapabilities = requiredCapabilities == null
                ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(requiredCapabilities));
        this.dependencies = dependencies == null
                ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
        if (this.dependencies.contains(id)) {
            throw new IllegalArgumentException("Task " + id + " cannot depend on itself");
        }
        this.estimatedEffort = estimatedEffort;
    }

    public String id() { return id; }
    public String goalId() { return goalId; }
    public String teamId() { return teamId; }
    public String description() { return description; }
    public String type() { return type; }
    public Set<String> requiredCapabilities() { return requiredCapabilities; }
    public Set<String> dependencies() { return dependencies; }
    public String estimatedEffort() { return estimatedEffort; }

    public TaskStatus status() { return status; }
    public Instant claimedAt() { return claimedAt; }
    public Instant completedAt() { return completedAt; }
    public TaskResult result() { return result; }
    public String assignedWorkerId() { return assignedWorkerId; }
    public BlockReason blockReason() { return blockReason; }

    public void setStatus(TaskStatus status) { this.status = status; }
    public void setClaimedAt(Instant claimedAt) { this.claimedAt = claimedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }
    public void setResult(TaskResult result) { this.result = result; }
    public void setAssignedWorkerId(String assignedWorkerId) { this.assignedWorkerId = assignedWorkerId; }

    /**
     * Marks the task blocked before it was ever claimed. Blocking a pending task is a
     * scheduling decision, not a lifecycle edge, so it does not go through the state machine.
     */
    public void markBlocked(BlockReason reason) {
        this.status = TaskStatus.BLOCKED;
        this.blockReason = reason;
    }

    @Override
    public String toString() {
        return "Task[" + id + ", type=" + type + ", status=" + status + ", deps=" + dependencies + "]";
    }
}
