package com.agentos.core.routing;

import com.agentos.core.model.Task;
import com.agentos.core.model.WorkerDescriptor;

import java.util.List;
import java.util.Optional;

/**
 * First worker whose capabilities cover the task; if none does, the first active worker.
 * The task then runs on a possibly under-qualified worker and execution failure is the
 * safety net.
 */
public class CapabilityFallbackPolicy implements WorkerSelectionPolicy {

    public static final String NAME = "capability-fallback";

    @Override
    public Optional<WorkerDescriptor> select(Task task, List<WorkerDescriptor> activeMembers) {
        return activeMembers.stream()
                .filter(w -> w.hasCapabilities(task.requiredCapabilities()))
                .findFirst()
                .or(() -> activeMembers.stream().findFirst());
    }
}
