package com.agentos.core.routing;

import com.agentos.core.config.AgentOsProperties;
import com.agentos.core.model.Team;
import com.agentos.core.model.WorkerDescriptor;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable view of configured workers and teams.
 */
public class Roster {

    private final Map<String, WorkerDescriptor> workers;
    private final Map<String, Team> teams;

    public Roster(Collection<WorkerDescriptor> workers, Collection<Team> teams) {
        var workerMap = new LinkedHashMap<String, WorkerDescriptor>();
        workers.forEach(w -> workerMap.put(w.id(), w));
        var teamMap = new LinkedHashMap<String, Team>();
        teams.forEach(t -> teamMap.put(t.id(), t));
        this.workers = Collections.unmodifiableMap(workerMap);
        this.teams = Collections.unmodifiableMap(teamMap);
    }

    /**
     * Builds the roster from configuration, enforcing cross references.
     *
     * @throws IllegalStateException if there are no agents or teams, or a reference dangles
     */
    public static Roster from(AgentOsProperties properties) {
        Map<String, AgentOsProperties.Agent> agents = properties.getAgents();
        Map<String, AgentOsProperties.Team> teams = properties.getTeams();
        if (agents == null || agents.isEmpty()) {
            throw new IllegalStateException("Config must have at least one agent defined");
        }
        if (teams == null || teams.isEmpty()) {
            throw new IllegalStateException("Config must have at least one team defined");
        }
        teams.forEach((teamId, team) -> {
            for (String agentId : team.getAgents()) {
                if (!agents.containsKey(agentId)) {
                    throw new IllegalStateException("Team " + teamId + " references unknown agent: " + agentId);
                }
            }
        });
        agents.forEach((agentId, agent) -> {
            for (String teamId : agent.getTeams()) {
                if (!teams.containsKey(teamId)) {
                    throw new IllegalStateException("Agent " + agentId + " references unknown team: " + teamId);
                }
            }
        });

        var workers = agents.entrySet().stream()
                .map(e -> new WorkerDescriptor(e.getKey(),
                        e.getValue().getName().isBlank() ? e.getKey() : e.getValue().getName(),
                        new LinkedHashSet<>(e.getValue().getCapabilities()),
                        new LinkedHashSet<>(e.getValue().getTeams()),
                        e.getValue().isActive(),
                        e.getValue().getMaxParallelTasks()))
                .toList();
        var teamList = teams.entrySet().stream()
                .map(e -> new Team(e.getKey(),
                        e.getValue().getName().isBlank() ? e.getKey() : e.getValue().getName(),
                        e.getValue().getAgents(),
                        e.getValue().getGoalsDir().isBlank() ? e.getKey() : e.getValue().getGoalsDir()))
                .toList();
        return new Roster(workers, teamList);
    }

    public Optional<Team> team(String teamId) {
        return Optional.ofNullable(teams.get(teamId));
    }

    public Collection<Team> teams() {
        return teams.values();
    }

    public Optional<WorkerDescriptor> worker(String workerId) {
        return Optional.ofNullable(workers.get(workerId));
    }

    public Collection<WorkerDescriptor> workers() {
        return workers.values();
    }

    /**
     * Active workers of the team, in roster order. Empty for an unknown team.
     */
    public List<WorkerDescriptor> activeMembers(String teamId) {
        Team team = teams.get(teamId);
        if (team == null) {
            return List.of();
        }
        return team.members().stream()
                .map(workers::get)
                .filter(Objects::nonNull)
                .filter(WorkerDescriptor::active)
                .toList();
    }
}
