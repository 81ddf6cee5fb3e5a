package com.agentos.dispatch.cli;

import com.agentos.core.config.AgentOsProperties;
import com.agentos.core.engine.GoalEngine;
import com.agentos.core.events.EventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * CLI command: agentos serve [--team &lt;id&gt;] [--interval &lt;duration&gt;]
 * <p>
 * Polls for goals until interrupted, waiting the polling interval between cycles.
 * A failing cycle is logged and the loop carries on.
 */
@Command(name = "serve", mixinStandardHelpOptions = true, description = "Poll for goals continuously")
@Component
public class ServeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ServeCommand.class);

    @Option(names = {"--team", "-t"}, description = "Only process goals of this team")
    private String team;

    @Option(names = {"--interval", "-i"},
            description = "Wait between cycles as an ISO-8601 duration, e.g. PT30S (default: agentos.polling-interval)")
    private Duration interval;

    @Option(names = "--max-cycles", description = "Stop after this many cycles (0 = run until interrupted)",
            defaultValue = "0")
    private int maxCycles;

    private final GoalEngine goalEngine;
    private final EventBus eventBus;
    private final AgentOsProperties properties;

    public ServeCommand(GoalEngine goalEngine, EventBus eventBus, AgentOsProperties properties) {
        this.goalEngine = goalEngine;
        this.eventBus = eventBus;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        Duration wait = interval != null ? interval : properties.getPollingInterval();
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Polling " + (team != null ? "team " + team : "all teams") + " every " + wait
                + ". Press Ctrl+C to stop.");

        // goal outcomes and budget alerts only
        EventBus.Subscription goals = eventBus.subscribeToType("goal.", ConsoleOutput::event);
        EventBus.Subscription alerts = eventBus.subscribeToType("cost.", ConsoleOutput::event);
        int cycles = 0;
        try {
            while (!Thread.currentThread().isInterrupted()) {
                try {
                    goalEngine.runCycle(team);
                } catch (Exception e) {
                    log.error("Cycle failed: {}", e.getMessage(), e);
                    ConsoleOutput.error("Cycle failed: " + e.getMessage());
                }
                cycles++;
                if (maxCycles > 0 && cycles >= maxCycles) {
                    break;
                }
                Thread.sleep(wait.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.info("Interrupted, stopping");
        } finally {
            goals.unsubscribe();
            alerts.unsubscribe();
        }
        ConsoleOutput.info("Stopped after " + cycles + " cycle(s)");
        return 0;
    }
}
