package com.agentos.core.routing;

import com.agentos.core.config.AgentOsProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RoutingConfig {

    @Bean
    public Roster roster(AgentOsProperties properties) {
        return Roster.from(properties);
    }

    @Bean
    public WorkerSelectionPolicy workerSelectionPolicy(AgentOsProperties properties) {
        String policy = properties.getRouting().getPolicy();
        if (StrictCapabilityPolicy.NAME.equalsIgnoreCase(policy)) {
            return new StrictCapabilityPolicy();
        }
        if (CapabilityFallbackPolicy.NAME.equalsIgnoreCase(policy)) {
            return new CapabilityFallbackPolicy();
        }
        throw new IllegalStateException("Unknown routing policy: " + policy
                + " (expected " + CapabilityFallbackPolicy.NAME + " or " + StrictCapabilityPolicy.NAME + ")");
    }

    @Bean
    public CapabilityRouter capabilityRouter(Roster roster, WorkerSelectionPolicy policy) {
        return new CapabilityRouter(roster, policy);
    }
}
