package com.agentos.core.routing;

import com.agentos.core.model.Task;
import com.agentos.core.model.WorkerDescriptor;

import java.util.List;
import java.util.Optional;

/**
 * Chooses a worker for a task from the team's active members (roster order).
 */
@FunctionalInterface
public interface WorkerSelectionPolicy {

    Optional<WorkerDescriptor> select(Task task, List<WorkerDescriptor> activeMembers);
}
