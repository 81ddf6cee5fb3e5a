package com.agentos.core.routing;

import com.agentos.core.model.Task;
import com.agentos.core.model.WorkerDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Selects a worker for a task from the active members of a team, using a
 * {@link WorkerSelectionPolicy}.
 */
public class CapabilityRouter {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRouter.class);

    private final Roster roster;
    private final WorkerSelectionPolicy policy;

    public CapabilityRouter(Roster roster, WorkerSelectionPolicy policy) {
        this.roster = roster;
        this.policy = policy;
    }

    public Optional<WorkerDescriptor> findWorker(Task task, String teamId) {
        List<WorkerDescriptor> active = roster.activeMembers(teamId);
        if (active.isEmpty()) {
            log.warn("No active workers in team {} for task {}", teamId, task.id());
            return Optional.empty();
        }
        Optional<WorkerDescriptor> selected = policy.select(task, active);
        selected.ifPresent(w -> {
            if (!w.hasCapabilities(task.requiredCapabilities())) {
                log.warn("Task {} requires {} but no worker in team {} matches; assigning {} ({})",
                        task.id(), task.requiredCapabilities(), teamId, w.id(), w.capabilities());
            } else {
                log.debug("Task {} routed to {}", task.id(), w.id());
            }
        });
        return selected;
    }
}
