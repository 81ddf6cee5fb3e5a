package com.agentos.core.nodes;

import com.agentos.core.llm.GenerateOptions;
import com.agentos.core.llm.LlmParseException;
import com.agentos.core.llm.LlmResponse;
import com.agentos.core.llm.LlmService;
import com.agentos.core.llm.PipelineStage;
import com.agentos.core.llm.StructuredOutputValidator;
import com.agentos.core.model.DecompositionPlan;
import com.agentos.core.model.Goal;
import com.agentos.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Breaks a structured goal into 1 to 10 tasks.
 * <p>
 * The model refers to dependencies by position; they are rewritten into task ids of the
 * form {@code <goalId>-task-<n>} (1-based). A position outside the plan becomes an id no
 * task carries, which the scheduler later blocks as an unknown dependency.
 */
@Component
public class DecomposeGoalNode {

    private static final Logger log = LoggerFactory.getLogger(DecomposeGoalNode.class);

    private static final String SYSTEM_PROMPT = """
            You are a planner breaking a goal into executable tasks for a team of workers.

            Each task should:
            - Be concrete and completable by one worker
            - Have a type such as research, write, code, design, review, analysis or test
            - List the capabilities (skills) a worker needs, e.g. ["research", "writing"]
            - Have a realistic effort estimate, e.g. "2 hours" or "1 day"
            - List dependencies as 0-based positions of earlier tasks in your list

            Produce between 1 and 10 tasks. Start with research or planning, then implementation,
            then review. A task never depends on itself.

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;
    private final StructuredOutputValidator validator;

    public DecomposeGoalNode(LlmService llmService, StructuredOutputValidator validator) {
        this.llmService = llmService;
        this.validator = validator;
    }

    public List<Task> apply(Goal goal) {
        LlmResponse response = llmService.generate(PipelineStage.DECOMPOSE,
                SYSTEM_PROMPT + "\n" + buildUserPrompt(goal),
                GenerateOptions.structured(DecompositionPlan.class));
        DecompositionPlan plan = validator.readWithRepair(response.text(), DecompositionPlan.class);
        List<Task> tasks = toTasks(goal, plan, response.text());
        log.info("Decomposed goal {} into {} task(s): {}", goal.id(), tasks.size(), plan.strategy());
        return tasks;
    }

    static List<Task> toTasks(Goal goal, DecompositionPlan plan, String rawText) {
        var tasks = new ArrayList<Task>();
        for (int i = 0; i < plan.tasks().size(); i++) {
            DecompositionPlan.TaskPlan tp = plan.tasks().get(i);
            var deps = new LinkedHashSet<String>();
            for (Integer ordinal : tp.dependencies()) {
                if (ordinal == i) {
                    throw new LlmParseException("Task " + (i + 1) + " of goal " + goal.id()
                            + " depends on itself", rawText);
                }
                if (ordinal >= plan.tasks().size()) {
                    log.warn("Task {} of goal {} depends on position {} outside the plan", i + 1, goal.id(), ordinal);
                }
                deps.add(taskId(goal.id(), ordinal));
            }
            tasks.add(new Task(taskId(goal.id(), i), goal.id(), goal.teamId(), tp.description(), tp.type(),
                    new LinkedHashSet<>(tp.requiredCapabilities()), deps, tp.estimatedEffort()));
        }
        return tasks;
    }

    public static String taskId(String goalId, int ordinal) {
        return goalId + "-task-" + (ordinal + 1);
    }

    private String buildUserPrompt(Goal goal) {
        var sb = new StringBuilder();
        sb.append("Goal: ").append(goal.description()).append("\n");
        sb.append("Priority: ").append(goal.priority().wireName()).append("\n");
        if (!goal.successCriteria().isEmpty()) {
            sb.append("\nSuccess Criteria:\n");
            goal.successCriteria().forEach(c -> sb.append("- ").append(c).append("\n"));
        }
        if (goal.context() != null) {
            sb.append("\nContext:\n").append(goal.context()).append("\n");
        }
        return sb.toString();
    }
}
