package com.agentos.dispatch.cli;

import com.agentos.core.engine.CycleSummary;
import com.agentos.core.engine.GoalEngine;
import com.agentos.core.events.EventBus;
import com.agentos.core.model.GoalStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: agentos run [--team &lt;id&gt;]
 * <p>
 * Runs a single processing cycle and prints live progress. Exits non-zero when any
 * goal failed.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run one processing cycle")
@Component
public class RunCommand implements Callable<Integer> {

    @Option(names = {"--team", "-t"}, description = "Only process goals of this team")
    private String team;

    private final GoalEngine goalEngine;
    private final EventBus eventBus;

    public RunCommand(GoalEngine goalEngine, EventBus eventBus) {
        this.goalEngine = goalEngine;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Polling goals" + (team != null ? " for team " + team : "") + "...");

        EventBus.Subscription subscription = eventBus.subscribeAll(ConsoleOutput::event);
        CycleSummary summary;
        try {
            summary = goalEngine.runCycle(team);
        } catch (Exception e) {
            ConsoleOutput.error("Cycle failed: " + e.getMessage());
            return 1;
        } finally {
            subscription.unsubscribe();
        }
        ConsoleOutput.cycleSummary(summary);
        return summary.count(GoalStatus.FAILED) > 0 ? 1 : 0;
    }
}
