package com.agentos.core.nodes;

import com.agentos.core.llm.GenerateOptions;
import com.agentos.core.llm.LlmResponse;
import com.agentos.core.llm.LlmService;
import com.agentos.core.llm.PipelineStage;
import com.agentos.core.llm.StructuredOutputValidator;
import com.agentos.core.model.Goal;
import com.agentos.core.model.GoalDraft;
import com.agentos.core.model.GoalStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;

/**
 * Turns the free-text description of a polled goal into a structured goal.
 * Identity fields come from the polled goal, never from the model.
 */
@Component
public class ParseGoalNode {

    private static final Logger log = LoggerFactory.getLogger(ParseGoalNode.class);

    static final String UNKNOWN_SOURCE = "unknown";

    private static final String SYSTEM_PROMPT = """
            You are an analyst turning a loosely written goal into a precise work order.

            Extract:
            1. A clear, concise description of what needs to be done
            2. Specific, measurable success criteria (how will we know it's done?)
            3. Any background context or constraints (omit if there are none)
            4. Priority level: low, medium, high or urgent

            Keep the author's intent. Do not invent requirements that are not implied by the input.
            If the input already lists success criteria, keep them and sharpen the wording.

            Respond with valid JSON matching the schema provided.
            """;

    private final LlmService llmService;
    private final StructuredOutputValidator validator;

    public ParseGoalNode(LlmService llmService, StructuredOutputValidator validator) {
        this.llmService = llmService;
        this.validator = validator;
    }

    public Goal apply(Goal raw) {
        String input = raw.description() == null ? "" : raw.description();
        log.info("Parsing goal {} ({} chars)", raw.id(), input.length());

        LlmResponse response = llmService.generate(PipelineStage.PARSE,
                SYSTEM_PROMPT + "\n" + buildUserPrompt(raw),
                GenerateOptions.structured(GoalDraft.class));
        GoalDraft draft = validator.readWithRepair(response.text(), GoalDraft.class);

        var metadata = new LinkedHashMap<>(raw.metadata());
        metadata.put("parsedAt", Instant.now().toString());
        metadata.put("inputLength", String.valueOf(input.length()));
        metadata.put("parsedBy", response.modelAlias());

        Goal goal = new Goal(raw.id(), raw.teamId(), draft.description(),
                draft.successCriteria(),
                draft.context() == null || draft.context().isBlank() ? raw.context() : draft.context(),
                draft.priority(),
                GoalStatus.PENDING,
                raw.createdBy(),
                raw.createdAt() != null ? raw.createdAt() : Instant.now(),
                raw.source() != null ? raw.source() : UNKNOWN_SOURCE,
                metadata);

        log.info("Parsed goal {}: priority={}, criteria={}", goal.id(),
                goal.priority().wireName(), goal.successCriteria().size());
        return goal;
    }

    private String buildUserPrompt(Goal raw) {
        var sb = new StringBuilder();
        sb.append("Input:\n\"\"\"\n").append(raw.description()).append("\n\"\"\"\n");
        if (!raw.successCriteria().isEmpty()) {
            sb.append("\nCriteria supplied by the author:\n");
            raw.successCriteria().forEach(c -> sb.append("- ").append(c).append("\n"));
        }
        if (raw.context() != null) {
            sb.append("\nContext supplied by the author:\n").append(raw.context()).append("\n");
        }
        return sb.toString();
    }
}
