package com.agentos.core.model;

/**
 * Why a task ended up blocked. None of these are exceptions: each resolves to a
 * {@link TaskStatus#BLOCKED} task plus a status report.
 */
public enum BlockReason {
    UNKNOWN_DEPENDENCY("unknown dependency"),
    BLOCKED_BY_DEPENDENCY("blocked by dependency"),
    UNRESOLVABLE_DEPENDENCIES("unresolvable dependencies"),
    NO_ELIGIBLE_WORKER("no eligible worker"),
    NEEDS_CLARIFICATION("needs clarification"),
    CLARIFICATION_FAILED("clarification check failed"),
    CLAIM_CONFLICT("already claimed by another actor");

    private final String description;

    BlockReason(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
