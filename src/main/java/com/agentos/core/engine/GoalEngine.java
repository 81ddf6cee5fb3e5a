package com.agentos.core.engine;

import com.agentos.core.config.AgentOsProperties;
import com.agentos.core.events.AgentOsEvent;
import com.agentos.core.events.EventBus;
import com.agentos.core.logging.MdcContext;
import com.agentos.core.metrics.AgentOsMetrics;
import com.agentos.core.model.ClarificationAssessment;
import com.agentos.core.model.Goal;
import com.agentos.core.model.GoalStatus;
import com.agentos.core.model.Task;
import com.agentos.core.nodes.ClarifyNode;
import com.agentos.core.nodes.DecomposeGoalNode;
import com.agentos.core.nodes.ParseGoalNode;
import com.agentos.core.scheduler.SchedulingResult;
import com.agentos.core.scheduler.TaskScheduler;
import com.agentos.core.source.GoalSource;
import com.agentos.core.source.ReportContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives processing cycles: poll goals, then for each goal parse, clarify, decompose,
 * run the tasks and report the goal's final status once.
 * <p>
 * Any exception while processing a goal is caught and reported as a goal failure, so one
 * goal never stops the others in the same cycle. With {@code agentos.max-parallel-goals}
 * above one, goals of a cycle run concurrently; tasks within a goal always run one at a time.
 */
@Service
public class GoalEngine {

    private static final Logger log = LoggerFactory.getLogger(GoalEngine.class);

    private final GoalSource goalSource;
    private final ParseGoalNode parseNode;
    private final ClarifyNode clarifyNode;
    private final DecomposeGoalNode decomposeNode;
    private final TaskScheduler scheduler;
    private final EventBus eventBus;
    private final AgentOsMetrics metrics;
    private final int maxParallelGoals;

    @Autowired
    public GoalEngine(GoalSource goalSource,
                      ParseGoalNode parseNode,
                      ClarifyNode clarifyNode,
                      DecomposeGoalNode decomposeNode,
                      TaskScheduler scheduler,
                      AgentOsProperties properties,
                      @Autowired(required = false) EventBus eventBus,
                      @Autowired(required = false) AgentOsMetrics metrics) {
        this(goalSource, parseNode, clarifyNode, decomposeNode, scheduler, eventBus, metrics,
                properties.getMaxParallelGoals());
    }

    public GoalEngine(GoalSource goalSource,
                      ParseGoalNode parseNode,
                      ClarifyNode clarifyNode,
                      DecomposeGoalNode decomposeNode,
                      TaskScheduler scheduler,
                      EventBus eventBus,
                      AgentOsMetrics metrics,
                      int maxParallelGoals) {
        this.goalSource = goalSource;
        this.parseNode = parseNode;
        this.clarifyNode = clarifyNode;
        this.decomposeNode = decomposeNode;
        this.scheduler = scheduler;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.maxParallelGoals = Math.max(1, maxParallelGoals);
    }

    /**
     * Runs one cycle for a team, or for every team when {@code teamId} is null.
     */
    public CycleSummary runCycle(String teamId) {
        List<Goal> goals = goalSource.pollGoals(teamId);
        if (metrics != null) {
            metrics.recordCycle(goals.size());
        }
        if (goals.isEmpty()) {
            log.debug("No pending goals for {}", teamId != null ? "team " + teamId : "any team");
            return CycleSummary.empty();
        }
        log.info("Cycle started: {} pending goal(s){}", goals.size(), teamId != null ? " for team " + teamId : "");

        List<GoalOutcome> outcomes = maxParallelGoals == 1 || goals.size() == 1
                ? goals.stream().map(this::processGoal).toList()
                : processConcurrently(goals);

        CycleSummary summary = new CycleSummary(outcomes);
        log.info("Cycle finished: {} completed, {} blocked, {} failed",
                summary.count(GoalStatus.COMPLETED), summary.count(GoalStatus.BLOCKED),
                summary.count(GoalStatus.FAILED));
        return summary;
    }

    private List<GoalOutcome> processConcurrently(List<Goal> goals) {
        var counter = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(maxParallelGoals, goals.size()), r -> {
            Thread t = new Thread(r, "goal-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<GoalOutcome>> futures = new ArrayList<>();
            for (Goal goal : goals) {
                futures.add(executor.submit(() -> processGoal(goal)));
            }
            var outcomes = new ArrayList<GoalOutcome>();
            for (int i = 0; i < futures.size(); i++) {
                try {
                    outcomes.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    // processGoal catches everything; this only covers Errors
                    log.error("Goal {} crashed: {}", goals.get(i).id(), e.getCause().getMessage(), e.getCause());
                    outcomes.add(new GoalOutcome(goals.get(i).id(), GoalStatus.FAILED,
                            String.valueOf(e.getCause()), null));
                }
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for goals to finish", e);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Processes one goal end to end and reports its final status. Never throws.
     */
    GoalOutcome processGoal(Goal goal) {
        MdcContext.setGoal(goal.id());
        long start = System.currentTimeMillis();
        try {
            log.info("Processing goal {} for team {}", goal.id(), goal.teamId());
            publish("goal.started", goal.id(), Map.of("teamId", String.valueOf(goal.teamId())));

            Goal parsed = parseNode.apply(goal);

            ClarificationAssessment clarification = clarifyNode.assessGoal(parsed);
            if (clarification.blocking()) {
                return blockForClarification(parsed, clarification);
            }

            List<Task> tasks = decomposeNode.apply(parsed);
            SchedulingResult result = scheduler.executeGoalTasks(tasks, parsed);

            String message = String.format("%d completed, %d failed, %d blocked of %d task(s)",
                    result.completedCount(), result.failedCount(), result.blockedCount(), tasks.size());
            finish(goal, result.goalStatus(), message, start);
            return new GoalOutcome(goal.id(), result.goalStatus(), message, result);
        } catch (Exception e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Goal {} failed: {}", goal.id(), message, e);
            finish(goal, GoalStatus.FAILED, message, start);
            return new GoalOutcome(goal.id(), GoalStatus.FAILED, message, null);
        } finally {
            MdcContext.clear();
        }
    }

    private GoalOutcome blockForClarification(Goal goal, ClarificationAssessment clarification) {
        String questions = clarification.formatQuestions();
        String text = "Goal " + goal.id() + " needs clarification (confidence "
                + clarification.confidence() + "/100)"
                + (questions.isEmpty() ? "" : "\n\n" + questions);
        goalSource.requestClarification(goal.id(), text);

        Goal blocked = goal.withStatus(GoalStatus.BLOCKED);
        String message = "Needs clarification: " + clarification.questions().size() + " question(s)";
        goalSource.report(blocked.id(), blocked.status().wireName(), message,
                ReportContext.goal(blocked.id(), blocked.teamId()));
        goalSource.notify("Goal " + goal.id() + " needs clarification");

        log.info("Goal {} blocked pending clarification", goal.id());
        publish("goal.blocked", goal.id(), Map.of("reason", "clarification",
                "questions", clarification.questions().size()));
        if (metrics != null) {
            metrics.recordGoalResult(GoalStatus.BLOCKED.wireName());
        }
        return new GoalOutcome(goal.id(), GoalStatus.BLOCKED, message, null);
    }

    private void finish(Goal goal, GoalStatus status, String message, long start) {
        try {
            Goal finished = goal.withStatus(status);
            goalSource.report(finished.id(), finished.status().wireName(), message,
                    ReportContext.goal(finished.id(), finished.teamId()));
        } catch (RuntimeException e) {
            log.error("Failed to report goal {} as {}: {}", goal.id(), status.wireName(), e.getMessage(), e);
        }
        publish("goal." + status.wireName(), goal.id(), Map.of("message", message,
                "durationMs", System.currentTimeMillis() - start));
        if (metrics != null) {
            metrics.recordGoalResult(status.wireName());
        }
        log.info("Goal {} {}: {}", goal.id(), status.wireName(), message);
    }

    private void publish(String type, String goalId, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(AgentOsEvent.of(type, goalId, null, payload));
        }
    }
}
