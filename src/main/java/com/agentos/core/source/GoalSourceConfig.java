package com.agentos.core.source;

import com.agentos.core.config.AgentOsProperties;
import com.agentos.core.routing.Roster;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class GoalSourceConfig {

    @Bean
    public FileSystemGoalSource fileSystemGoalSource(AgentOsProperties properties, Roster roster) {
        return new FileSystemGoalSource(Path.of(properties.getGoals().getBaseDir()), roster);
    }
}
