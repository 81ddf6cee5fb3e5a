package com.agentos.core.source;

import com.agentos.core.model.EntityType;

/**
 * Discriminator passed with every status report.
 *
 * @param entity whether the id names a goal or a task
 * @param teamId owning team, may be {@code null}
 * @param goalId owning goal for task reports; equals the id for goal reports
 */
public record ReportContext(EntityType entity, String teamId, String goalId) {

    public static ReportContext goal(String goalId, String teamId) {
        return new ReportContext(EntityType.GOAL, teamId, goalId);
    }

    public static ReportContext task(String goalId, String teamId) {
        return new ReportContext(EntityType.TASK, teamId, goalId);
    }
}
