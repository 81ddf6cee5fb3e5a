package com.agentos.core.nodes;

import com.agentos.core.llm.GenerateOptions;
import com.agentos.core.llm.LlmResponse;
import com.agentos.core.llm.LlmService;
import com.agentos.core.llm.PipelineStage;
import com.agentos.core.llm.StructuredOutputValidator;
import com.agentos.core.model.ExecutionOutput;
import com.agentos.core.model.Goal;
import com.agentos.core.model.Task;
import com.agentos.core.model.TaskMetrics;
import com.agentos.core.model.TaskResult;
import com.agentos.core.model.WorkerDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Carries out one task on behalf of a worker. Model selection follows the task type.
 */
@Component
public class ExecuteTaskNode {

    private static final Logger log = LoggerFactory.getLogger(ExecuteTaskNode.class);

    private static final String SYSTEM_PROMPT = """
            You are %s, a worker with these capabilities: %s.
            Carry out the task below as part of a larger goal and report what you produced.

            ## Output
            - summary: what was done and the outcome, in a few sentences
            - artifacts: everything you produced, each with type (file, url, document, code),
              a short name and a location; use an empty list if nothing was produced

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;
    private final StructuredOutputValidator validator;

    public ExecuteTaskNode(LlmService llmService, StructuredOutputValidator validator) {
        this.llmService = llmService;
        this.validator = validator;
    }

    public TaskResult apply(Task task, Goal goal, WorkerDescriptor worker) {
        String prompt = SYSTEM_PROMPT.formatted(worker.name(), String.join(", ", worker.capabilities()))
                + "\n" + buildUserPrompt(task, goal);

        long start = System.currentTimeMillis();
        LlmResponse response = llmService.generate(PipelineStage.EXECUTE, prompt,
                GenerateOptions.structured(ExecutionOutput.class).withTaskType(task.type()));
        long duration = System.currentTimeMillis() - start;

        ExecutionOutput output = validator.readWithRepair(response.text(), ExecutionOutput.class);
        var metrics = new TaskMetrics(duration, response.usage().promptTokens(), response.usage().completionTokens());
        log.info("Task {} executed by {} on {} in {}ms ({} artifact(s))", task.id(), worker.id(),
                response.modelAlias(), duration, output.artifacts().size());
        return new TaskResult(output.summary(), output.artifacts(), metrics);
    }

    private String buildUserPrompt(Task task, Goal goal) {
        var sb = new StringBuilder();
        sb.append("## Goal\n").append(goal.description()).append("\n");
        if (!goal.successCriteria().isEmpty()) {
            sb.append("\nSuccess criteria:\n");
            goal.successCriteria().forEach(c -> sb.append("- ").append(c).append("\n"));
        }
        if (goal.context() != null) {
            sb.append("\nContext:\n").append(goal.context()).append("\n");
        }
        sb.append("\n## Task (").append(task.type()).append(")\n").append(task.description()).append("\n");
        if (task.estimatedEffort() != null) {
            sb.append("Estimated effort: ").append(task.estimatedEffort()).append("\n");
        }
        return sb.toString();
    }
}
