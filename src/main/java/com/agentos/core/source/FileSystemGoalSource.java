package com.agentos.core.source;

import com.agentos.core.model.EntityType;
import com.agentos.core.model.Goal;
import com.agentos.core.model.GoalStatus;
import com.agentos.core.model.Priority;
import com.agentos.core.model.TaskStatus;
import com.agentos.core.model.Team;
import com.agentos.core.routing.Roster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Goal source backed by Markdown files.
 * <p>
 * Each team owns a directory under the base directory holding {@code <goalId>.goal.md}
 * files. A goal file starts with a {@code ---} delimited block of {@code key: value}
 * lines followed by the free-text goal description:
 * <pre>
 * ---
 * status: pending
 * priority: high
 * createdBy: alice
 * successCriteria: page loads under 2s; no console errors
 * ---
 * Speed up the landing page.
 * </pre>
 * Completed goals move to the team's {@code done/} directory. Claims are lock files under
 * {@code <baseDir>/.locks}, created with {@code CREATE_NEW} so the first writer wins
 * across processes. A task's lock is deleted when the task is reported {@code failed},
 * so a later run may claim it again; locks of completed and blocked tasks are kept.
 */
public class FileSystemGoalSource implements GoalSource {

    private static final Logger log = LoggerFactory.getLogger(FileSystemGoalSource.class);

    public static final String SOURCE_NAME = "filesystem";
    static final String GOAL_SUFFIX = ".goal.md";
    static final String DONE_DIR = "done";
    static final String LOCK_DIR = ".locks";
    private static final String DELIMITER = "---";
    private static final String LIST_SEPARATOR = ";";

    private final Path baseDir;
    private final Roster roster;

    public FileSystemGoalSource(Path baseDir, Roster roster) {
        this.baseDir = baseDir;
        this.roster = roster;
    }

    public Path getBaseDir() {
        return baseDir;
    }

    public Path teamDir(String teamId) {
        String dir = roster.team(teamId).map(Team::goalsDir).orElse(teamId);
        return baseDir.resolve(dir);
    }

    @Override
    public List<Goal> pollGoals(String teamId) {
        List<String> teamIds = teamId != null
                ? List.of(teamId)
                : roster.teams().stream().map(Team::id).toList();
        var goals = new ArrayList<Goal>();
        for (String id : teamIds) {
            goals.addAll(pollTeam(id));
        }
        return goals;
    }

    private List<Goal> pollTeam(String teamId) {
        Path dir = teamDir(teamId);
        if (!Files.isDirectory(dir)) {
            log.debug("Goals directory {} does not exist for team {}", dir, teamId);
            return List.of();
        }
        List<Path> files;
        try (Stream<Path> listing = Files.list(dir)) {
            files = listing
                    .filter(p -> p.getFileName().toString().endsWith(GOAL_SUFFIX))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list goals in " + dir, e);
        }

        var goals = new ArrayList<Goal>();
        for (Path file : files) {
            try {
                GoalFile parsed = GoalFile.parse(Files.readString(file, StandardCharsets.UTF_8));
                String status = parsed.frontmatter().getOrDefault("status", GoalStatus.PENDING.wireName());
                if (!GoalStatus.PENDING.wireName().equalsIgnoreCase(status)) {
                    continue;
                }
                goals.add(toGoal(teamId, file, parsed));
            } catch (IOException e) {
                log.warn("Skipping unreadable goal file {}: {}", file, e.getMessage());
            }
        }
        log.debug("Polled {} pending goal(s) for team {}", goals.size(), teamId);
        return goals;
    }

    private Goal toGoal(String teamId, Path file, GoalFile parsed) throws IOException {
        Map<String, String> fm = parsed.frontmatter();
        String fileName = file.getFileName().toString();
        String goalId = fileName.substring(0, fileName.length() - GOAL_SUFFIX.length());

        List<String> criteria = Optional.ofNullable(fm.get("successCriteria"))
                .map(v -> Arrays.stream(v.split(LIST_SEPARATOR))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .toList())
                .orElse(List.of());

        return new Goal(goalId, teamId, parsed.body(), criteria,
                blankToNull(fm.get("context")),
                parsePriority(fm.get("priority"), fileName),
                GoalStatus.PENDING,
                fm.getOrDefault("createdBy", "unknown"),
                parseInstant(fm.get("createdAt"), file),
                SOURCE_NAME,
                Map.of("file", file.toString()));
    }

    @Override
    public boolean claim(String id, String workerId) {
        Path lock = lockFile(id);
        try {
            Files.createDirectories(lock.getParent());
            Files.writeString(lock, workerId, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
            return true;
        } catch (FileAlreadyExistsException e) {
            log.info("{} already claimed: {}", id, lock);
            return false;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to claim " + id, e);
        }
    }

    @Override
    public void report(String id, String status, String message, ReportContext context) {
        try {
            if (context.entity() == EntityType.TASK) {
                appendProgress(id, status, message, context);
                if (TaskStatus.FAILED.wireName().equalsIgnoreCase(status)) {
                    releaseClaim(id);
                }
            } else {
                updateGoal(id, status, message, context.teamId());
            }
        } catch (IOException e) {
            log.error("Failed to report {} {} as {}: {}", context.entity().wireName(), id, status, e.getMessage(), e);
        }
    }

    private Path lockFile(String id) {
        return baseDir.resolve(LOCK_DIR).resolve(id + ".lock");
    }

    private void releaseClaim(String id) throws IOException {
        if (Files.deleteIfExists(lockFile(id))) {
            log.info("Released claim on failed task {}", id);
        }
    }

    private void appendProgress(String taskId, String status, String message, ReportContext context)
            throws IOException {
        Path dir = resolveTeamDir(context.goalId(), context.teamId());
        Files.createDirectories(dir);
        String line = Instant.now() + " " + taskId + " " + status
                + (message == null || message.isBlank() ? "" : " " + message.replace('\n', ' '))
                + System.lineSeparator();
        Files.writeString(dir.resolve(context.goalId() + ".progress.log"), line, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    private void updateGoal(String goalId, String status, String message, String teamId) throws IOException {
        Path dir = resolveTeamDir(goalId, teamId);
        Path file = dir.resolve(goalId + GOAL_SUFFIX);
        if (!Files.exists(file)) {
            log.warn("Goal file {} not found, cannot record status {}", file, status);
            return;
        }
        GoalFile parsed = GoalFile.parse(Files.readString(file, StandardCharsets.UTF_8));
        var fm = new LinkedHashMap<>(parsed.frontmatter());
        fm.put("status", status);
        if (message != null && !message.isBlank()) {
            fm.put("lastMessage", message.replace('\n', ' '));
        }
        String content = new GoalFile(fm, parsed.body()).render();

        if (GoalStatus.COMPLETED.wireName().equalsIgnoreCase(status)) {
            Path doneDir = dir.resolve(DONE_DIR);
            Files.createDirectories(doneDir);
            Files.writeString(doneDir.resolve(file.getFileName()), content, StandardCharsets.UTF_8);
            Files.delete(file);
            log.info("Goal {} completed, moved to {}", goalId, doneDir);
        } else {
            Files.writeString(file, content, StandardCharsets.UTF_8);
        }
    }

    @Override
    public void requestClarification(String goalId, String questionText) {
        Path dir = resolveTeamDir(goalId, null);
        String content = "# Clarification Request" + "\n\n"
                + "Goal: " + goalId + "\n\n"
                + "## Questions\n" + questionText + "\n\n"
                + "## Status\nAwaiting answer...\n";
        try {
            Files.createDirectories(dir);
            Files.writeString(dir.resolve(goalId + ".clarification.md"), content, StandardCharsets.UTF_8);
            log.info("Clarification requested for goal {}", goalId);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write clarification request for " + goalId, e);
        }
    }

    @Override
    public void notify(String message) {
        log.info("[NOTIFY] {}", message);
    }

    /**
     * Writes a new pending goal file for the team and returns its id.
     */
    public String submit(String teamId, String description, Priority priority, String createdBy) {
        if (roster.team(teamId).isEmpty()) {
            throw new IllegalArgumentException("Unknown team: " + teamId);
        }
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Goal description must not be blank");
        }
        Instant now = Instant.now();
        String goalId = "goal-" + now.toEpochMilli() + "-" + UUID.randomUUID().toString().substring(0, 8);

        var fm = new LinkedHashMap<String, String>();
        fm.put("status", GoalStatus.PENDING.wireName());
        fm.put("priority", (priority == null ? Priority.MEDIUM : priority).wireName());
        fm.put("createdBy", createdBy == null || createdBy.isBlank() ? "cli" : createdBy);
        fm.put("createdAt", now.toString());

        Path dir = teamDir(teamId);
        try {
            Files.createDirectories(dir);
            Files.writeString(dir.resolve(goalId + GOAL_SUFFIX), new GoalFile(fm, description.strip()).render(),
                    StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write goal file for team " + teamId, e);
        }
        log.info("Submitted goal {} to team {}", goalId, teamId);
        return goalId;
    }

    /**
     * Team directory holding the goal file; searched across teams when the team is unknown.
     */
    private Path resolveTeamDir(String goalId, String teamId) {
        if (teamId != null) {
            return teamDir(teamId);
        }
        return roster.teams().stream()
                .map(t -> teamDir(t.id()))
                .filter(dir -> Files.exists(dir.resolve(goalId + GOAL_SUFFIX)))
                .findFirst()
                .orElse(baseDir);
    }

    private static Priority parsePriority(String value, String fileName) {
        if (value == null || value.isBlank()) {
            return Priority.MEDIUM;
        }
        try {
            return Priority.fromValue(value);
        } catch (IllegalArgumentException e) {
            log.warn("Goal file {} has unknown priority '{}', using medium", fileName, value);
            return Priority.MEDIUM;
        }
    }

    private static Instant parseInstant(String value, Path file) throws IOException {
        if (value != null && !value.isBlank()) {
            try {
                return Instant.parse(value);
            } catch (DateTimeParseException e) {
                log.warn("Goal file {} has unparseable createdAt '{}', using file time", file, value);
            }
        }
        return Files.getLastModifiedTime(file).toInstant();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    /**
     * Frontmatter plus body of a goal file.
     */
    record GoalFile(Map<String, String> frontmatter, String body) {

        static GoalFile parse(String content) {
            String normalized = content.replace("\r\n", "\n");
            if (!normalized.startsWith(DELIMITER + "\n")) {
                return new GoalFile(Map.of(), normalized.strip());
            }
            int end = normalized.indexOf("\n" + DELIMITER, DELIMITER.length());
            if (end < 0) {
                return new GoalFile(Map.of(), normalized.strip());
            }
            var fm = new LinkedHashMap<String, String>();
            String header = end > DELIMITER.length() ? normalized.substring(DELIMITER.length() + 1, end) : "";
            for (String line : header.split("\n")) {
                int colon = line.indexOf(':');
                if (colon > 0) {
                    fm.put(line.substring(0, colon).trim(), line.substring(colon + 1).trim());
                }
            }
            String body = normalized.substring(end + DELIMITER.length() + 1);
            return new GoalFile(fm, body.strip());
        }

        String render() {
            String header = frontmatter.entrySet().stream()
                    .map(e -> e.getKey() + ": " + e.getValue())
                    .collect(Collectors.joining("\n"));
            return DELIMITER + "\n" + header + "\n" + DELIMITER + "\n" + body + "\n";
        }
    }
}
