package com.agentos.dispatch.cli;

import com.agentos.core.engine.CycleSummary;
import com.agentos.core.engine.GoalOutcome;
import com.agentos.core.events.AgentOsEvent;
import picocli.CommandLine;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * ANSI-colored terminal output utilities for the AgentOS CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) AGENTOS v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [AGENTOS]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void event(AgentOsEvent event) {
        String prefix = switch (event.eventType()) {
            case "goal.started" -> "@|fg(cyan) [GOAL]|@";
            case "goal.completed" -> "@|fg(green),bold [GOAL DONE]|@";
            case "goal.failed" -> "@|fg(red),bold [GOAL FAILED]|@";
            case "goal.blocked" -> "@|fg(yellow),bold [GOAL BLOCKED]|@";
            case "task.dispatched" -> "@|fg(blue) [TASK]|@";
            case "task.completed" -> "@|fg(green) [TASK DONE]|@";
            case "task.failed" -> "@|fg(red) [TASK FAILED]|@";
            case "task.blocked" -> "@|fg(yellow) [TASK BLOCKED]|@";
            case "cost.alert" -> "@|fg(magenta),bold [BUDGET]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String subject = event.taskId() != null ? event.taskId()
                : event.goalId() != null ? event.goalId() : "";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                prefix + " " + subject + " " + formatPayload(event.payload())));
    }

    public static void cycleSummary(CycleSummary summary) {
        System.out.println("──────────────────────────────────");
        if (summary.size() == 0) {
            info("No pending goals");
            return;
        }
        for (GoalOutcome outcome : summary.outcomes()) {
            String line = outcome.goalId() + " " + outcome.status().wireName() + ": " + outcome.message();
            switch (outcome.status()) {
                case COMPLETED -> success(line);
                case BLOCKED -> warn(line);
                default -> error(line);
            }
        }
    }

    private static String formatPayload(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return "";
        }
        return payload.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(" "));
    }
}
