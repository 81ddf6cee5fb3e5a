package com.agentos.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "agentos")
public class AgentOsProperties {

    private Map<String, Agent> agents = new LinkedHashMap<>();
    private Map<String, Team> teams = new LinkedHashMap<>();
    private Goals goals = new Goals();
    private Routing routing = new Routing();
    private CostTracking costTracking = new CostTracking();
    private Duration pollingInterval = Duration.ofSeconds(60);
    private int maxParallelGoals = 1;

    public Map<String, Agent> getAgents() { return agents; }
    public void setAgents(Map<String, Agent> agents) { this.agents = agents; }
    public Map<String, Team> getTeams() { return teams; }
    public void setTeams(Map<String, Team> teams) { this.teams = teams; }
    public Goals getGoals() { return goals; }
    public void setGoals(Goals goals) { this.goals = goals; }
    public Routing getRouting() { return routing; }
    public void setRouting(Routing routing) { this.routing = routing; }
    public CostTracking getCostTracking() { return costTracking; }
    public void setCostTracking(CostTracking costTracking) { this.costTracking = costTracking; }
    public Duration getPollingInterval() { return pollingInterval; }
    public void setPollingInterval(Duration pollingInterval) { this.pollingInterval = pollingInterval; }
    public int getMaxParallelGoals() { return maxParallelGoals; }
    public void setMaxParallelGoals(int maxParallelGoals) { this.maxParallelGoals = maxParallelGoals; }

    public static class Agent {
        private String name = "";
        private List<String> capabilities = new ArrayList<>();
        private List<String> teams = new ArrayList<>();
        private int maxParallelTasks = 1;
        private boolean active = true;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public List<String> getCapabilities() { return capabilities; }
        public void setCapabilities(List<String> capabilities) { this.capabilities = capabilities; }
        public List<String> getTeams() { return teams; }
        public void setTeams(List<String> teams) { this.teams = teams; }
        public int getMaxParallelTasks() { return maxParallelTasks; }
        public void setMaxParallelTasks(int maxParallelTasks) { this.maxParallelTasks = maxParallelTasks; }
        public boolean isActive() { return active; }
        public void setActive(boolean active) { this.active = active; }
    }

    public static class Team {
        private String name = "";
        private List<String> agents = new ArrayList<>();
        private String goalsDir = "";

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public List<String> getAgents() { return agents; }
        public void setAgents(List<String> agents) { this.agents = agents; }
        public String getGoalsDir() { return goalsDir; }
        public void setGoalsDir(String goalsDir) { this.goalsDir = goalsDir; }
    }

    public static class Goals {
        private String baseDir = "./goals";

        public String getBaseDir() { return baseDir; }
        public void setBaseDir(String baseDir) { this.baseDir = baseDir; }
    }

    public static class Routing {
        /** {@code capability-fallback} or {@code strict}. */
        private String policy = "capability-fallback";

        public String getPolicy() { return policy; }
        public void setPolicy(String policy) { this.policy = policy; }
    }

    public static class CostTracking {
        private boolean enabled = true;
        private double monthlyBudget = 100.0;
        private String currency = "USD";
        private int alertAtPercent = 80;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public double getMonthlyBudget() { return monthlyBudget; }
        public void setMonthlyBudget(double monthlyBudget) { this.monthlyBudget = monthlyBudget; }
        public String getCurrency() { return currency; }
        public void setCurrency(String currency) { this.currency = currency; }
        public int getAlertAtPercent() { return alertAtPercent; }
        public void setAlertAtPercent(int alertAtPercent) { this.alertAtPercent = alertAtPercent; }
    }
}
