package com.agentos.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GoalTest {

    private static Goal goal(GoalStatus status) {
        return new Goal("g1", "core", "Ship it", List.of("shipped"), null, Priority.HIGH, status,
                "alice", Instant.parse("2026-01-01T00:00:00Z"), "filesystem", Map.of("k", "v"));
    }

    @Test
    @DisplayName("pending goals may move to blocked, completed or failed")
    void pendingAdvances() {
        Goal blocked = goal(GoalStatus.PENDING).withStatus(GoalStatus.BLOCKED);
        assertEquals(GoalStatus.BLOCKED, blocked.status());
        assertEquals("Ship it", blocked.description());
        assertEquals(GoalStatus.COMPLETED, blocked.withStatus(GoalStatus.COMPLETED).status());
        assertEquals(GoalStatus.FAILED, goal(GoalStatus.PENDING).withStatus(GoalStatus.FAILED).status());
    }

    @Test
    @DisplayName("terminal goals never move and blocked goals never return to pending")
    void noBackwardMoves() {
        assertThrows(IllegalStateException.class, () -> goal(GoalStatus.COMPLETED).withStatus(GoalStatus.FAILED));
        assertThrows(IllegalStateException.class, () -> goal(GoalStatus.FAILED).withStatus(GoalStatus.PENDING));
        assertThrows(IllegalStateException.class, () -> goal(GoalStatus.BLOCKED).withStatus(GoalStatus.PENDING));
    }

    @Test
    @DisplayName("moving to the current status returns the same instance")
    void sameStatus() {
        Goal g = goal(GoalStatus.COMPLETED);
        assertSame(g, g.withStatus(GoalStatus.COMPLETED));
    }

    @Test
    @DisplayName("defaults and defensive copies")
    void defaults() {
        var criteria = new ArrayList<>(List.of("a"));
        Goal g = new Goal("g2", "core", "x", criteria, null, null, null, "bob", null, null, null);
        criteria.add("b");

        assertEquals(Priority.MEDIUM, g.priority());
        assertEquals(GoalStatus.PENDING, g.status());
        assertEquals(List.of("a"), g.successCriteria());
        assertTrue(g.metadata().isEmpty());
        assertThrows(IllegalArgumentException.class,
                () -> new Goal(" ", "core", "x", null, null, null, null, null, null, null, null));
    }
}
