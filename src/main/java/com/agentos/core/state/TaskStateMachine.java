package com.agentos.core.state;

import com.agentos.core.model.Task;
import com.agentos.core.model.TaskStatus;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.agentos.core.model.TaskStatus.*;

/**
 * Task lifecycle transition table. Holds no task storage.
 */
@Component
public class TaskStateMachine {

    private static final Map<TaskStatus, Set<TaskStatus>> TRANSITIONS = new EnumMap<>(TaskStatus.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(CLAIMED));
        TRANSITIONS.put(CLAIMED, EnumSet.of(IN_PROGRESS, FAILED));
        TRANSITIONS.put(IN_PROGRESS, EnumSet.of(BLOCKED, COMPLETED, FAILED));
        TRANSITIONS.put(BLOCKED, EnumSet.of(IN_PROGRESS, FAILED));
        TRANSITIONS.put(COMPLETED, EnumSet.noneOf(TaskStatus.class));
        // failed -> pending is the retry re-entry point
        TRANSITIONS.put(FAILED, EnumSet.of(PENDING));
    }

    private final Clock clock;

    public TaskStateMachine() {
        this(Clock.systemUTC());
    }

    public TaskStateMachine(Clock clock) {
        this.clock = clock;
    }

    public boolean canTransition(TaskStatus from, TaskStatus to) {
        Set<TaskStatus> allowed = TRANSITIONS.get(from);
        return allowed != null && allowed.contains(to);
    }

    public Set<TaskStatus> allowedTransitions(TaskStatus from) {
        return Set.copyOf(TRANSITIONS.getOrDefault(from, Set.of()));
    }

    /**
     * Moves the task to {@code to} if the table allows it. Never throws; a rejected
     * transition leaves the task untouched.
     */
    public TransitionResult transition(Task task, TaskStatus to) {
        TaskStatus from = task.status();
        if (!canTransition(from, to)) {
            return TransitionResult.rejected(
                    "Cannot transition task " + task.id() + " " + from.wireName() + " -> " + to.wireName());
        }
        task.setStatus(to);
        if (to == CLAIMED) {
            task.setClaimedAt(clock.instant());
        }
        if (to == COMPLETED || to == FAILED) {
            task.setCompletedAt(clock.instant());
        }
        return TransitionResult.ok();
    }

    /**
     * Like {@link #transition} but treats a rejected edge as a programming error.
     *
     * @throws IllegalTransitionException if the edge is not in the table
     */
    public void transitionOrThrow(Task task, TaskStatus to) {
        TransitionResult result = transition(task, to);
        if (!result.success()) {
            throw new IllegalTransitionException(result.error());
        }
    }
}
