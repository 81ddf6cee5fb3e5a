package com.agentos.core.scheduler;

import com.agentos.core.events.AgentOsEvent;
import com.agentos.core.events.EventBus;
import com.agentos.core.logging.MdcContext;
import com.agentos.core.metrics.AgentOsMetrics;
import com.agentos.core.model.BlockReason;
import com.agentos.core.model.ClarificationAssessment;
import com.agentos.core.model.Goal;
import com.agentos.core.model.Task;
import com.agentos.core.model.TaskResult;
import com.agentos.core.model.TaskStatus;
import com.agentos.core.model.WorkerDescriptor;
import com.agentos.core.nodes.ClarifyNode;
import com.agentos.core.nodes.ExecuteTaskNode;
import com.agentos.core.routing.CapabilityRouter;
import com.agentos.core.source.GoalSource;
import com.agentos.core.source.ReportContext;
import com.agentos.core.state.TaskStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs one goal's tasks in dependency order.
 * <p>
 * Works in passes over the remaining tasks until none are left or a pass removes
 * nothing. A task is dispatched once all of its dependencies completed; it is blocked
 * when a dependency is unknown to the batch or itself failed or blocked. Whatever is
 * left after a pass without progress sits on a cycle and is blocked as unresolvable.
 * Tasks run one at a time, so at most {@code tasks.size()} passes happen.
 * <p>
 * The goal-level status is derived here but reported by the caller.
 */
@Service
public class TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    private final TaskStateMachine stateMachine;
    private final CapabilityRouter router;
    private final ClarifyNode clarifyNode;
    private final ExecuteTaskNode executeTaskNode;
    private final GoalSource goalSource;
    private final EventBus eventBus;
    private final AgentOsMetrics metrics;

    public TaskScheduler(TaskStateMachine stateMachine,
                         CapabilityRouter router,
                         ClarifyNode clarifyNode,
                         ExecuteTaskNode executeTaskNode,
                         GoalSource goalSource,
                         @Autowired(required = false) EventBus eventBus,
                         @Autowired(required = false) AgentOsMetrics metrics) {
        this.stateMachine = stateMachine;
        this.router = router;
        this.clarifyNode = clarifyNode;
        this.executeTaskNode = executeTaskNode;
        this.goalSource = goalSource;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public SchedulingResult executeGoalTasks(List<Task> tasks, Goal goal) {
        Set<String> allIds = tasks.stream().map(Task::id).collect(Collectors.toSet());
        Map<String, Task> remaining = new LinkedHashMap<>();
        tasks.forEach(t -> remaining.put(t.id(), t));

        Set<String> completed = new LinkedHashSet<>();
        Set<String> failed = new LinkedHashSet<>();
        Set<String> blocked = new LinkedHashSet<>();

        int pass = 0;
        while (!remaining.isEmpty()) {
            pass++;
            boolean progress = false;
            log.debug("Goal {} pass {}: {} task(s) remaining", goal.id(), pass, remaining.size());

            for (Task task : new ArrayList<>(remaining.values())) {
                Set<String> deps = task.dependencies();

                List<String> unknown = deps.stream().filter(d -> !allIds.contains(d)).toList();
                if (!unknown.isEmpty()) {
                    block(task, goal, BlockReason.UNKNOWN_DEPENDENCY, String.join(", ", unknown));
                    blocked.add(task.id());
                    remaining.remove(task.id());
                    progress = true;
                    continue;
                }

                List<String> dead = deps.stream()
                        .filter(d -> failed.contains(d) || blocked.contains(d))
                        .toList();
                if (!dead.isEmpty()) {
                    block(task, goal, BlockReason.BLOCKED_BY_DEPENDENCY, String.join(", ", dead));
                    blocked.add(task.id());
                    remaining.remove(task.id());
                    progress = true;
                    continue;
                }

                if (!completed.containsAll(deps)) {
                    continue;
                }

                TaskStatus outcome = dispatch(task, goal);
                switch (outcome) {
                    case COMPLETED -> completed.add(task.id());
                    case FAILED -> failed.add(task.id());
                    default -> blocked.add(task.id());
                }
                remaining.remove(task.id());
                progress = true;
            }

            if (!progress) {
                log.warn("Goal {}: no progress in pass {}, blocking {} task(s) on unresolvable dependencies",
                        goal.id(), pass, remaining.size());
                for (Task task : remaining.values()) {
                    block(task, goal, BlockReason.UNRESOLVABLE_DEPENDENCIES,
                            String.join(", ", task.dependencies()));
                    blocked.add(task.id());
                }
                remaining.clear();
            }
        }

        SchedulingResult result = new SchedulingResult(completed, failed, blocked,
                SchedulingResult.deriveStatus(failed, blocked));
        log.info("Goal {} tasks settled after {} pass(es): {} completed, {} failed, {} blocked -> {}",
                goal.id(), pass, result.completedCount(), result.failedCount(), result.blockedCount(),
                result.goalStatus().wireName());
        return result;
    }

    /**
     * Routes, clarifies, claims and executes a task whose dependencies are satisfied.
     *
     * @return the terminal status for this cycle: completed, failed or blocked
     */
    private TaskStatus dispatch(Task task, Goal goal) {
        MdcContext.setTask(goal.id(), task.id());
        try {
            Optional<WorkerDescriptor> selected = router.findWorker(task, goal.teamId());
            if (selected.isEmpty()) {
                block(task, goal, BlockReason.NO_ELIGIBLE_WORKER, "team " + goal.teamId());
                return TaskStatus.BLOCKED;
            }
            WorkerDescriptor worker = selected.get();
            MdcContext.setWorker(worker.id());

            ClarificationAssessment clarification;
            try {
                clarification = clarifyNode.assessTask(task, goal);
            } catch (RuntimeException e) {
                log.warn("Clarification of task {} failed: {}", task.id(), e.getMessage());
                block(task, goal, BlockReason.CLARIFICATION_FAILED, e.getMessage());
                return TaskStatus.BLOCKED;
            }
            if (clarification.blocking()) {
                requestClarification(task, goal, clarification);
                block(task, goal, BlockReason.NEEDS_CLARIFICATION,
                        clarification.questions().size() + " open question(s)");
                return TaskStatus.BLOCKED;
            }

            if (!goalSource.claim(task.id(), worker.id())) {
                block(task, goal, BlockReason.CLAIM_CONFLICT, null);
                return TaskStatus.BLOCKED;
            }

            stateMachine.transitionOrThrow(task, TaskStatus.CLAIMED);
            task.setAssignedWorkerId(worker.id());
            report(task, goal, TaskStatus.CLAIMED, "Claimed by " + worker.id());

            stateMachine.transitionOrThrow(task, TaskStatus.IN_PROGRESS);
            report(task, goal, TaskStatus.IN_PROGRESS, "Starting execution");
            publish("task.dispatched", task, Map.of("workerId", worker.id(), "type", String.valueOf(task.type())));

            long start = System.currentTimeMillis();
            TaskResult result;
            try {
                result = executeTaskNode.apply(task, goal, worker);
            } catch (RuntimeException e) {
                log.error("Task {} failed on {}: {}", task.id(), worker.id(), e.getMessage(), e);
                stateMachine.transitionOrThrow(task, TaskStatus.FAILED);
                report(task, goal, TaskStatus.FAILED, errorText(e));
                publish("task.failed", task, Map.of("workerId", worker.id(), "error", errorText(e)));
                recordOutcome(task, TaskStatus.FAILED, System.currentTimeMillis() - start);
                return TaskStatus.FAILED;
            }

            task.setResult(result);
            stateMachine.transitionOrThrow(task, TaskStatus.COMPLETED);
            report(task, goal, TaskStatus.COMPLETED, result.summary());
            publish("task.completed", task, Map.of("workerId", worker.id(),
                    "artifacts", result.artifacts().size(),
                    "durationMs", result.metrics().durationMs()));
            recordOutcome(task, TaskStatus.COMPLETED, result.metrics().durationMs());
            return TaskStatus.COMPLETED;
        } finally {
            MdcContext.clearTask();
        }
    }

    private void requestClarification(Task task, Goal goal, ClarificationAssessment clarification) {
        String text = "Task " + task.id() + ": " + task.description() + "\n\n" + clarification.formatQuestions();
        try {
            goalSource.requestClarification(goal.id(), text);
        } catch (RuntimeException e) {
            log.warn("Failed to request clarification for task {}: {}", task.id(), e.getMessage());
        }
    }

    private void block(Task task, Goal goal, BlockReason reason, String detail) {
        task.markBlocked(reason);
        String message = detail == null || detail.isBlank()
                ? reason.description()
                : reason.description() + ": " + detail;
        log.warn("Task {} blocked: {}", task.id(), message);
        report(task, goal, TaskStatus.BLOCKED, message);
        var payload = new HashMap<String, Object>();
        payload.put("reason", reason.name());
        payload.put("message", message);
        publish("task.blocked", task, payload);
        recordOutcome(task, TaskStatus.BLOCKED, -1);
    }

    private void report(Task task, Goal goal, TaskStatus status, String message) {
        try {
            goalSource.report(task.id(), status.wireName(), message, ReportContext.task(goal.id(), goal.teamId()));
        } catch (RuntimeException e) {
            log.warn("Failed to report task {} as {}: {}", task.id(), status.wireName(), e.getMessage());
        }
    }

    private void publish(String type, Task task, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(AgentOsEvent.of(type, task.goalId(), task.id(), payload));
        }
    }

    private void recordOutcome(Task task, TaskStatus status, long durationMs) {
        if (metrics == null) {
            return;
        }
        metrics.recordTaskOutcome(status.wireName());
        if (durationMs >= 0) {
            metrics.recordTaskExecution(task.type(), durationMs);
        }
    }

    private static String errorText(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
