package com.agentos.core.model;

import java.util.Locale;

/**
 * Status of a goal. Flows pending, optionally blocked, then completed or failed.
 */
public enum GoalStatus {
    PENDING,
    BLOCKED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Whether a goal in this status may move to {@code next}. Terminal states never move.
     */
    public boolean canAdvanceTo(GoalStatus next) {
        return switch (this) {
            case PENDING -> next != PENDING;
            case BLOCKED -> next.isTerminal();
            case COMPLETED, FAILED -> false;
        };
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
