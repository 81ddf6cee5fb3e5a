package com.agentos.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while goals are processed.
 *
 * @param eventType e.g. "goal.started", "task.completed", "cost.alert"
 * @param goalId    the goal this event belongs to (nullable for process-level events)
 * @param taskId    the task this event relates to (nullable for goal-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record AgentOsEvent(
    String eventType,
    String goalId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) {
    public static AgentOsEvent of(String eventType, String goalId, String taskId, Map<String, Object> payload) {
        return new AgentOsEvent(eventType, goalId, taskId, Map.copyOf(payload), Instant.now());
    }
}
