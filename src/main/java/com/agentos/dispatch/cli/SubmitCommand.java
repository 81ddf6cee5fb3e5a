package com.agentos.dispatch.cli;

import com.agentos.core.model.Priority;
import com.agentos.core.source.FileSystemGoalSource;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: agentos submit --team &lt;id&gt; "&lt;goal&gt;"
 * <p>
 * Writes a new pending goal for the team; the next cycle picks it up.
 */
@Command(name = "submit", mixinStandardHelpOptions = true, description = "Submit a new goal")
@Component
public class SubmitCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Free-text goal description")
    private String description;

    @Option(names = {"--team", "-t"}, required = true, description = "Team that owns the goal")
    private String team;

    @Option(names = {"--priority", "-p"}, defaultValue = "medium",
            description = "low, medium, high or urgent (default: ${DEFAULT-VALUE})")
    private String priority;

    @Option(names = "--by", defaultValue = "cli", description = "Author recorded on the goal")
    private String createdBy;

    private final FileSystemGoalSource goalSource;

    public SubmitCommand(FileSystemGoalSource goalSource) {
        this.goalSource = goalSource;
    }

    @Override
    public Integer call() {
        Priority parsedPriority;
        try {
            parsedPriority = Priority.fromValue(priority);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid priority: " + priority + ". Valid: low, medium, high, urgent");
            return 2;
        }
        try {
            String goalId = goalSource.submit(team, description, parsedPriority, createdBy);
            ConsoleOutput.success("Submitted goal " + goalId + " to team " + team);
            return 0;
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }
    }
}
