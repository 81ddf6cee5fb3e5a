package com.agentos.core.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Decompose-stage output: one to ten tasks whose dependencies are 0-based positions
 * within the same list.
 *
 * @param tasks    planned tasks in order
 * @param strategy short note on how the tasks achieve the goal
 */
public record DecompositionPlan(
    @NotNull @Size(min = 1, max = 10) List<@Valid @NotNull TaskPlan> tasks,
    String strategy
) {

    /**
     * @param description          what the task should accomplish
     * @param type                 task type tag, e.g. research, code, write, review
     * @param requiredCapabilities capabilities a worker needs
     * @param estimatedEffort      free-form estimate, e.g. "2h"
     * @param dependencies         positions of prerequisite tasks in this plan, may be omitted
     */
    public record TaskPlan(
        @NotBlank String description,
        @NotBlank String type,
        @NotNull List<@NotBlank String> requiredCapabilities,
        String estimatedEffort,
        List<@NotNull @PositiveOrZero Integer> dependencies
    ) {
        public TaskPlan {
            dependencies = dependencies == null ? List.of() : dependencies;
        }
    }
}
