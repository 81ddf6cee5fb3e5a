package com.agentos.core.engine;

import com.agentos.core.model.GoalStatus;
import com.agentos.core.scheduler.SchedulingResult;

/**
 * What happened to one goal in a cycle.
 *
 * @param goalId     the goal
 * @param status     the status reported for it
 * @param message    the message reported with it
 * @param scheduling task counts, {@code null} when the goal never reached scheduling
 */
public record GoalOutcome(
    String goalId,
    GoalStatus status,
    String message,
    SchedulingResult scheduling
) {}
