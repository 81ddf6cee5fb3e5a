package com.agentos.core.model;

import java.util.Locale;

/**
 * Lifecycle status of a single task.
 */
public enum TaskStatus {
    PENDING,
    CLAIMED,
    IN_PROGRESS,
    BLOCKED,
    COMPLETED,
    FAILED;

    /** Lower-case form used in status reports, e.g. {@code in_progress}. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
