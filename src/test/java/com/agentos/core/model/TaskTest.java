package com.agentos.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TaskTest {

    @Test
    @DisplayName("a task cannot depend on itself")
    void rejectsSelfDependency() {
        var e = assertThrows(IllegalArgumentException.class,
                () -> new Task("t1", "g", "core", "x", "code", Set.of(), Set.of("t0", "t1"), null));
        assertTrue(e.getMessage().contains("t1"));
    }

    @Test
    @DisplayName("new tasks are pending and unassigned")
    void initialState() {
        var task = new Task("t1", "g", "core", "x", "code", null, null, null);

        assertEquals(TaskStatus.PENDING, task.status());
        assertTrue(task.dependencies().isEmpty());
        assertTrue(task.requiredCapabilities().isEmpty());
        assertNull(task.assignedWorkerId());
        assertNull(task.blockReason());
    }

    @Test
    @DisplayName("marking blocked records the reason without touching timestamps")
    void markBlocked() {
        var task = new Task("t1", "g", "core", "x", "code", Set.of("code"), Set.of(), null);

        task.markBlocked(BlockReason.NO_ELIGIBLE_WORKER);

        assertEquals(TaskStatus.BLOCKED, task.status());
        assertEquals(BlockReason.NO_ELIGIBLE_WORKER, task.blockReason());
        assertNull(task.claimedAt());
        assertNull(task.completedAt());
    }

    @Test
    @DisplayName("required capabilities are read-only")
    void capabilitiesReadOnly() {
        var task = new Task("t1", "g", "core", "x", "code", Set.of("code"), Set.of(), null);
        assertThrows(UnsupportedOperationException.class, () -> task.requiredCapabilities().add("ops"));
    }
}
