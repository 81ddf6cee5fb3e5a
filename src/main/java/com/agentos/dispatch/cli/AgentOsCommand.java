package com.agentos.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for AgentOS.
 * Routes to subcommands: run, serve, submit, health, models.
 */
@Command(
        name = "agentos",
        mixinStandardHelpOptions = true,
        version = "AgentOS 0.1.0",
        description = "Turns goals into tasks and runs them on a team of workers",
        subcommands = {
                RunCommand.class,
                ServeCommand.class,
                SubmitCommand.class,
                HealthCommand.class,
                ModelsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AgentOsCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}
