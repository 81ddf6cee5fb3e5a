package com.agentos.core.routing;

import com.agentos.core.model.Task;
import com.agentos.core.model.WorkerDescriptor;

import java.util.List;
import java.util.Optional;

/**
 * Only a worker whose capabilities cover the task qualifies.
 */
public class StrictCapabilityPolicy implements WorkerSelectionPolicy {

    public static final String NAME = "strict";

    @Override
    public Optional<WorkerDescriptor> select(Task task, List<WorkerDescriptor> activeMembers) {
        return activeMembers.stream()
                .filter(w -> w.hasCapabilities(task.requiredCapabilities()))
                .findFirst();
    }
}
