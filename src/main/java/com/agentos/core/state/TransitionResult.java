package com.agentos.core.state;

/**
 * Outcome of {@link TaskStateMachine#transition}.
 */
public record TransitionResult(boolean success, String error) {

    public static TransitionResult ok() {
        return new TransitionResult(true, null);
    }

    public static TransitionResult rejected(String error) {
        return new TransitionResult(false, error);
    }
}
