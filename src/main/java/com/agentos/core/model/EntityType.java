package com.agentos.core.model;

import java.util.Locale;

/**
 * Discriminates goal-level from task-level status reports.
 */
public enum EntityType {
    GOAL,
    TASK;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
