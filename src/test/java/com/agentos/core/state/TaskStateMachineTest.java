package com.agentos.core.state;

import com.agentos.core.model.Task;
import com.agentos.core.model.TaskStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.Set;

import static com.agentos.core.model.TaskStatus.*;
import static org.junit.jupiter.api.Assertions.*;

class TaskStateMachineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final TaskStateMachine machine = new TaskStateMachine(Clock.fixed(NOW, ZoneOffset.UTC));

    private static Task taskIn(TaskStatus status) {
        var task = new Task("g-task-1", "g", "core", "do it", "code", Set.of(), Set.of(), "1h");
        task.setStatus(status);
        return task;
    }

    @Test
    @DisplayName("table matches the documented lifecycle")
    void tableMatchesLifecycle() {
        assertEquals(EnumSet.of(CLAIMED), machine.allowedTransitions(PENDING));
        assertEquals(EnumSet.of(IN_PROGRESS, FAILED), machine.allowedTransitions(CLAIMED));
        assertEquals(EnumSet.of(BLOCKED, COMPLETED, FAILED), machine.allowedTransitions(IN_PROGRESS));
        assertEquals(EnumSet.of(IN_PROGRESS, FAILED), machine.allowedTransitions(BLOCKED));
        assertTrue(machine.allowedTransitions(COMPLETED).isEmpty());
        assertEquals(EnumSet.of(PENDING), machine.allowedTransitions(FAILED));
    }

    @ParameterizedTest
    @EnumSource(TaskStatus.class)
    @DisplayName("every allowed edge succeeds and stamps timestamps only where specified")
    void allowedEdgesSucceed(TaskStatus from) {
        for (TaskStatus to : machine.allowedTransitions(from)) {
            Task task = taskIn(from);
            TransitionResult result = machine.transition(task, to);

            assertTrue(result.success(), from + " -> " + to);
            assertNull(result.error());
            assertEquals(to, task.status());
            assertEquals(to == CLAIMED ? NOW : null, task.claimedAt(), "claimedAt for " + to);
            assertEquals(to == COMPLETED || to == FAILED ? NOW : null, task.completedAt(), "completedAt for " + to);
        }
    }

    @ParameterizedTest
    @EnumSource(TaskStatus.class)
    @DisplayName("every edge outside the table is rejected and leaves the task untouched")
    void disallowedEdgesRejected(TaskStatus from) {
        for (TaskStatus to : TaskStatus.values()) {
            if (machine.canTransition(from, to)) {
                continue;
            }
            Task task = taskIn(from);
            TransitionResult result = machine.transition(task, to);

            assertFalse(result.success(), from + " -> " + to);
            assertNotNull(result.error());
            assertEquals(from, task.status());
            assertNull(task.claimedAt());
            assertNull(task.completedAt());
        }
    }

    @Test
    @DisplayName("completed is terminal")
    void completedIsTerminal() {
        for (TaskStatus to : TaskStatus.values()) {
            assertFalse(machine.canTransition(COMPLETED, to));
        }
    }

    @Test
    @DisplayName("failed re-enters pending for retry")
    void failedReentersPending() {
        Task task = taskIn(FAILED);
        assertTrue(machine.transition(task, PENDING).success());
        assertEquals(PENDING, task.status());
    }

    @Test
    @DisplayName("transitionOrThrow raises IllegalTransitionException on a bad edge")
    void transitionOrThrowRaises() {
        Task task = taskIn(PENDING);
        var ex = assertThrows(IllegalTransitionException.class, () -> machine.transitionOrThrow(task, COMPLETED));
        assertTrue(ex.getMessage().contains("pending -> completed"));
    }
}
