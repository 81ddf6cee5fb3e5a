package com.agentos.core.engine;

import com.agentos.core.model.GoalStatus;

import java.util.List;

public record CycleSummary(List<GoalOutcome> outcomes) {

    public CycleSummary {
        outcomes = List.copyOf(outcomes);
    }

    public static CycleSummary empty() {
        return new CycleSummary(List.of());
    }

    public long count(GoalStatus status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }

    public int size() {
        return outcomes.size();
    }
}
