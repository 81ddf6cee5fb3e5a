package com.agentos.core.nodes;

import com.agentos.core.llm.GenerateOptions;
import com.agentos.core.llm.KeyCasingNormalizer;
import com.agentos.core.llm.LlmParseException;
import com.agentos.core.llm.LlmService;
import com.agentos.core.llm.ModelClient;
import com.agentos.core.llm.ModelDefinition;
import com.agentos.core.llm.ModelPricing;
import com.agentos.core.llm.ModelRegistry;
import com.agentos.core.llm.ModelReply;
import com.agentos.core.llm.PipelineConfig;
import com.agentos.core.llm.PipelineStage;
import com.agentos.core.llm.StageConfig;
import com.agentos.core.llm.StructuredOutputValidator;
import com.agentos.core.llm.TokenUsage;
import com.agentos.core.model.Task;
import com.agentos.core.model.TaskStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class DecomposeGoalNodeTest {

    private final StructuredOutputValidator validator = new StructuredOutputValidator(new KeyCasingNormalizer());

    private DecomposeGoalNode nodeReturning(String json) {
        LlmService llm = mock(LlmService.class);
        when(llm.generate(eq(PipelineStage.DECOMPOSE), anyString(), any(GenerateOptions.class)))
                .thenReturn(NodeFixtures.response(json));
        return new DecomposeGoalNode(llm, validator);
    }

    @Test
    @DisplayName("rewrites ordinal dependencies into stable task ids")
    void rewritesDependencies() {
        List<Task> tasks = nodeReturning("""
                {"strategy": "research then write",
                 "tasks": [
                   {"description": "Gather data", "type": "research", "requiredCapabilities": ["research"],
                    "estimatedEffort": "2h", "dependencies": []},
                   {"description": "Write report", "type": "write", "requiredCapabilities": ["writing"],
                    "estimatedEffort": "3h", "dependencies": [0]},
                   {"description": "Review report", "type": "review", "requiredCapabilities": ["review"],
                    "estimatedEffort": "1h", "dependencies": [0, 1]}
                 ]}
                """).apply(NodeFixtures.goal("goal-42"));

        assertEquals(3, tasks.size());
        assertEquals("goal-42-task-1", tasks.get(0).id());
        assertEquals(Set.of(), tasks.get(0).dependencies());
        assertEquals(Set.of("goal-42-task-1"), tasks.get(1).dependencies());
        assertEquals(Set.of("goal-42-task-1", "goal-42-task-2"), tasks.get(2).dependencies());

        Task review = tasks.get(2);
        assertEquals("goal-42", review.goalId());
        assertEquals("core", review.teamId());
        assertEquals("review", review.type());
        assertEquals(Set.of("review"), review.requiredCapabilities());
        assertEquals("1h", review.estimatedEffort());
        assertEquals(TaskStatus.PENDING, review.status());
    }

    @Test
    @DisplayName("omitted dependencies mean none")
    void missingDependencies() {
        List<Task> tasks = nodeReturning("""
                {"strategy": "s", "tasks": [
                  {"description": "Only", "type": "code", "requiredCapabilities": []}
                ]}
                """).apply(NodeFixtures.goal("g"));
        assertTrue(tasks.get(0).dependencies().isEmpty());
    }

    @Test
    @DisplayName("a task depending on its own position is rejected")
    void rejectsSelfReference() {
        var node = nodeReturning("""
                {"strategy": "s", "tasks": [
                  {"description": "A", "type": "code", "requiredCapabilities": [], "dependencies": []},
                  {"description": "B", "type": "code", "requiredCapabilities": [], "dependencies": [1]}
                ]}
                """);
        var ex = assertThrows(LlmParseException.class, () -> node.apply(NodeFixtures.goal("g")));
        assertTrue(ex.getMessage().contains("depends on itself"));
    }

    @Test
    @DisplayName("a position outside the plan becomes an id no task carries")
    void outOfRangeBecomesUnknownId() {
        List<Task> tasks = nodeReturning("""
                {"strategy": "s", "tasks": [
                  {"description": "A", "type": "code", "requiredCapabilities": [], "dependencies": [5]}
                ]}
                """).apply(NodeFixtures.goal("g"));
        assertEquals(Set.of("g-task-6"), tasks.get(0).dependencies());
    }

    @Test
    @DisplayName("an empty task list is a parse error")
    void rejectsEmptyPlan() {
        var node = nodeReturning("{\"strategy\": \"s\", \"tasks\": []}");
        assertThrows(LlmParseException.class, () -> node.apply(NodeFixtures.goal("g")));
    }

    @Test
    @DisplayName("a refusal instead of a plan fails with LlmParseException")
    void refusalIsParseError() {
        var node = nodeReturning("Sorry, I cannot help with that.");
        var ex = assertThrows(LlmParseException.class, () -> node.apply(NodeFixtures.goal("g")));
        assertTrue(ex.getMessage().contains("DecompositionPlan"), ex.getMessage());
        assertEquals("Sorry, I cannot help with that.", ex.getResponseExcerpt());
    }

    @Test
    @DisplayName("a refusal from a real model call surfaces unwrapped after a single attempt")
    void refusalThroughLlmServiceIsNotRetried() {
        var calls = new AtomicInteger();
        ModelClient refusing = prompt -> {
            calls.incrementAndGet();
            return new ModelReply("Sorry, I cannot help with that.", new TokenUsage(10, 10));
        };
        var pricing = new ModelPricing(0.0, 0.0);
        var registry = ModelRegistry.builder()
                .register(new ModelDefinition("primary", "openai", "p", "http://localhost", pricing), refusing)
                .register(new ModelDefinition("fallback", "openai", "f", "http://localhost", pricing), refusing)
                .build();
        var stages = new EnumMap<PipelineStage, StageConfig>(PipelineStage.class);
        for (PipelineStage stage : PipelineStage.values()) {
            stages.put(stage, new StageConfig(stage, "primary", "fallback", Duration.ofSeconds(5), 2, Map.of()));
        }
        var llm = new LlmService(registry, new PipelineConfig(stages), null, null);
        try {
            var node = new DecomposeGoalNode(llm, validator);
            assertThrows(LlmParseException.class, () -> node.apply(NodeFixtures.goal("g")));
            assertEquals(1, calls.get());
        } finally {
            llm.shutdown();
        }
    }
}
