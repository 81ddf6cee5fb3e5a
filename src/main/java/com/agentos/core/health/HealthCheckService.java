package com.agentos.core.health;

import com.agentos.core.llm.ModelRegistry;
import com.agentos.core.model.Team;
import com.agentos.core.routing.Roster;
import com.agentos.core.source.FileSystemGoalSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ModelRegistry modelRegistry;
    private final Roster roster;
    private final FileSystemGoalSource goalSource;

    public HealthCheckService(
            @Autowired(required = false) ModelRegistry modelRegistry,
            @Autowired(required = false) Roster roster,
            @Autowired(required = false) FileSystemGoalSource goalSource) {
        this.modelRegistry = modelRegistry;
        this.roster = roster;
        this.goalSource = goalSource;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkModels());
        results.add(checkGoalDirectories());
        results.add(checkRoster());
        return results;
    }

    private HealthStatus checkModels() {
        if (modelRegistry == null) {
            return new HealthStatus("models", HealthStatus.Status.DOWN, "No model registry configured", Map.of());
        }
        var unavailable = new TreeMap<String, String>();
        modelRegistry.entries().stream()
                .filter(e -> !e.available())
                .forEach(e -> unavailable.put(e.definition().alias(), e.unavailableReason()));
        int total = modelRegistry.aliases().size();
        if (unavailable.isEmpty()) {
            return new HealthStatus("models", HealthStatus.Status.UP,
                    total + " model(s) available", Map.of());
        }
        if (unavailable.size() == total) {
            return new HealthStatus("models", HealthStatus.Status.DOWN,
                    "No model provider initialized", unavailable);
        }
        return new HealthStatus("models", HealthStatus.Status.DEGRADED,
                (total - unavailable.size()) + " of " + total + " model(s) available", unavailable);
    }

    private HealthStatus checkGoalDirectories() {
        if (goalSource == null || roster == null) {
            return new HealthStatus("goals", HealthStatus.Status.DOWN, "No goal source configured", Map.of());
        }
        var problems = new TreeMap<String, String>();
        for (Team team : roster.teams()) {
            Path dir = goalSource.teamDir(team.id());
            if (!Files.isDirectory(dir)) {
                problems.put(team.id(), "missing: " + dir);
            } else if (!Files.isWritable(dir)) {
                problems.put(team.id(), "not writable: " + dir);
            }
        }
        if (problems.isEmpty()) {
            return new HealthStatus("goals", HealthStatus.Status.UP,
                    "Goal directories present under " + goalSource.getBaseDir(), Map.of());
        }
        log.warn("Goal directory problems: {}", problems);
        return new HealthStatus("goals", HealthStatus.Status.DEGRADED,
                problems.size() + " team directory problem(s)", problems);
    }

    private HealthStatus checkRoster() {
        if (roster == null) {
            return new HealthStatus("roster", HealthStatus.Status.DOWN, "No roster configured", Map.of());
        }
        var empty = new TreeMap<String, String>();
        for (Team team : roster.teams()) {
            if (roster.activeMembers(team.id()).isEmpty()) {
                empty.put(team.id(), "no active workers");
            }
        }
        if (empty.isEmpty()) {
            return new HealthStatus("roster", HealthStatus.Status.UP,
                    roster.workers().size() + " worker(s) across " + roster.teams().size() + " team(s)", Map.of());
        }
        return new HealthStatus("roster", HealthStatus.Status.DEGRADED,
                empty.size() + " team(s) without active workers", empty);
    }
}
