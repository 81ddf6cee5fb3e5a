package com.agentos.core.state;

/**
 * Thrown when code insists on a state-machine edge the transition table forbids.
 * Indicates a logic fault, not a task failure.
 */
public class IllegalTransitionException extends RuntimeException {

    public IllegalTransitionException(String message) {
        super(message);
    }
}
