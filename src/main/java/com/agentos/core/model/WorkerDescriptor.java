package com.agentos.core.model;

import java.util.Set;

/**
 * A worker ("agent") that can be assigned tasks.
 *
 * @param maxParallelTasks advisory only; the scheduler does not enforce it
 */
public record WorkerDescriptor(
    String id,
    String name,
    Set<String> capabilities,
    Set<String> teams,
    boolean active,
    int maxParallelTasks
) {
    public WorkerDescriptor {
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
        teams = teams == null ? Set.of() : Set.copyOf(teams);
    }

    public boolean hasCapabilities(Set<String> required) {
        return capabilities.containsAll(required);
    }
}
