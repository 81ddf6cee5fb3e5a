package com.agentos.core.nodes;

import com.agentos.core.llm.GenerateOptions;
import com.agentos.core.llm.LlmResponse;
import com.agentos.core.llm.LlmService;
import com.agentos.core.llm.PipelineStage;
import com.agentos.core.llm.StructuredOutputValidator;
import com.agentos.core.model.ClarificationAssessment;
import com.agentos.core.model.ClarificationResponse;
import com.agentos.core.model.Goal;
import com.agentos.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides whether a goal or a task is clear enough to work on.
 * <p>
 * The verdict is blocking when the model says the input is not clear, when its
 * confidence is under {@link #CONFIDENCE_THRESHOLD}, or when any question is blocking.
 */
@Component
public class ClarifyNode {

    private static final Logger log = LoggerFactory.getLogger(ClarifyNode.class);

    /** Policy constant; not configurable. */
    public static final int CONFIDENCE_THRESHOLD = 60;

    private static final String SYSTEM_PROMPT = """
            You review work requests before anyone starts on them. Decide whether the request
            below can be carried out as written, or whether someone must answer questions first.

            ## Rules

            1. isClearEnough is true only if a competent worker could start right now
            2. confidence is an integer from 0 to 100 expressing how sure you are of that judgement
            3. Ask only questions whose answers would change the work; zero questions is fine
            4. Mark a question blocking only if work cannot sensibly start without the answer
            5. urgency is low, medium or high
            6. For every question say why it matters and what you would assume if nobody answers

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;
    private final StructuredOutputValidator validator;

    public ClarifyNode(LlmService llmService, StructuredOutputValidator validator) {
        this.llmService = llmService;
        this.validator = validator;
    }

    public ClarificationAssessment assessGoal(Goal goal) {
        var sb = new StringBuilder();
        sb.append("## Goal\n").append(goal.description()).append("\n");
        appendCriteria(sb, goal);
        ClarificationAssessment assessment = assess(sb.toString());
        log.info("Goal {} clarity: clear={}, confidence={}, questions={}, blocking={}", goal.id(),
                assessment.clearEnough(), assessment.confidence(), assessment.questions().size(),
                assessment.blocking());
        return assessment;
    }

    public ClarificationAssessment assessTask(Task task, Goal goal) {
        var sb = new StringBuilder();
        sb.append("## Task (").append(task.type()).append(")\n").append(task.description()).append("\n");
        if (!task.requiredCapabilities().isEmpty()) {
            sb.append("\nRequired capabilities: ").append(String.join(", ", task.requiredCapabilities())).append("\n");
        }
        sb.append("\n## Parent goal\n").append(goal.description()).append("\n");
        appendCriteria(sb, goal);
        ClarificationAssessment assessment = assess(sb.toString());
        log.info("Task {} clarity: clear={}, confidence={}, blocking={}", task.id(),
                assessment.clearEnough(), assessment.confidence(), assessment.blocking());
        return assessment;
    }

    private ClarificationAssessment assess(String userPrompt) {
        LlmResponse response = llmService.generate(PipelineStage.CLARIFY,
                SYSTEM_PROMPT + "\n" + userPrompt,
                GenerateOptions.structured(ClarificationResponse.class));
        return toAssessment(validator.readWithRepair(response.text(), ClarificationResponse.class));
    }

    static ClarificationAssessment toAssessment(ClarificationResponse response) {
        boolean anyBlocking = response.questions().stream().anyMatch(q -> Boolean.TRUE.equals(q.blocking()));
        boolean blocking = !response.isClearEnough()
                || response.confidence() < CONFIDENCE_THRESHOLD
                || anyBlocking;
        return new ClarificationAssessment(response.isClearEnough(), response.confidence(),
                response.questions(), blocking);
    }

    private static void appendCriteria(StringBuilder sb, Goal goal) {
        if (!goal.successCriteria().isEmpty()) {
            sb.append("\nSuccess criteria:\n");
            goal.successCriteria().forEach(c -> sb.append("- ").append(c).append("\n"));
        }
        if (goal.context() != null) {
            sb.append("\nContext:\n").append(goal.context()).append("\n");
        }
    }
}
