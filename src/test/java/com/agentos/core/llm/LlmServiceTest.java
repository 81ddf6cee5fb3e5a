package com.agentos.core.llm;

import com.agentos.core.cost.CostSink;
import com.agentos.core.metrics.AgentOsMetrics;
import com.agentos.core.model.ClarificationResponse;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class LlmServiceTest {

    private static final ModelPricing PRICING = new ModelPricing(1.0, 2.0);

    private LlmService service;

    @AfterEach
    void tearDown() {
        if (service != null) {
            service.shutdown();
        }
    }

    private static ModelDefinition def(String alias) {
        return new ModelDefinition(alias, "openai", alias + "-id", "http://localhost", PRICING);
    }

    private static PipelineConfig pipeline(int maxRetries, Duration timeout, Map<String, String> byType) {
        var stages = new EnumMap<PipelineStage, StageConfig>(PipelineStage.class);
        for (PipelineStage stage : PipelineStage.values()) {
            stages.put(stage, new StageConfig(stage, "primary", "fallback", timeout, maxRetries,
                    stage == PipelineStage.EXECUTE ? byType : Map.of()));
        }
        return new PipelineConfig(stages);
    }

    private LlmService service(ModelRegistry registry, PipelineConfig pipeline, CostSink sink) {
        service = new LlmService(registry, pipeline, sink, null);
        return service;
    }

    private static ModelClient failing(AtomicInteger calls, String message) {
        return prompt -> {
            calls.incrementAndGet();
            throw new IllegalStateException(message);
        };
    }

    private static ModelClient replying(AtomicInteger calls, String text) {
        return prompt -> {
            calls.incrementAndGet();
            return new ModelReply(text, new TokenUsage(1000, 500));
        };
    }

    @Test
    @DisplayName("maxRetries=1 tries the primary twice, then succeeds on the fallback")
    void retriesPrimaryThenFallsBack() {
        var primaryCalls = new AtomicInteger();
        var fallbackCalls = new AtomicInteger();
        var registry = ModelRegistry.builder()
                .register(def("primary"), failing(primaryCalls, "boom"))
                .register(def("fallback"), replying(fallbackCalls, "hello"))
                .build();

        LlmResponse response = service(registry, pipeline(1, Duration.ofSeconds(5), Map.of()), null)
                .generate(PipelineStage.PARSE, "prompt");

        assertEquals("hello", response.text());
        assertEquals("fallback", response.modelAlias());
        assertEquals(3, response.attempts());
        assertEquals(2, primaryCalls.get());
        assertEquals(1, fallbackCalls.get());
    }

    @Test
    @DisplayName("exhausting every model surfaces the last underlying error")
    void exhaustionPreservesLastError() {
        var calls = new AtomicInteger();
        var registry = ModelRegistry.builder()
                .register(def("primary"), failing(calls, "primary down"))
                .register(def("fallback"), failing(calls, "fallback down"))
                .build();

        var ex = assertThrows(LlmInvocationException.class, () ->
                service(registry, pipeline(2, Duration.ofSeconds(5), Map.of()), null)
                        .generate(PipelineStage.DECOMPOSE, "prompt"));

        assertEquals(6, calls.get());
        assertEquals(6, ex.getAttempts());
        assertEquals(PipelineStage.DECOMPOSE, ex.getStage());
        assertEquals("fallback down", ex.getMessage());
        assertInstanceOf(IllegalStateException.class, ex.getCause());
        assertEquals("fallback down", ex.getCause().getMessage());
    }

    @Test
    @DisplayName("a call outliving the stage timeout fails that attempt")
    void timeoutIsAnAttemptFailure() {
        var fallbackCalls = new AtomicInteger();
        ModelClient slow = prompt -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new ModelReply("too late", TokenUsage.EMPTY);
        };
        var registry = ModelRegistry.builder()
                .register(def("primary"), slow)
                .register(def("fallback"), replying(fallbackCalls, "on time"))
                .build();

        long start = System.currentTimeMillis();
        LlmResponse response = service(registry, pipeline(0, Duration.ofMillis(100), Map.of()), null)
                .generate(PipelineStage.CLARIFY, "prompt");

        assertEquals("on time", response.text());
        assertEquals(2, response.attempts());
        assertTrue(System.currentTimeMillis() - start < 4_000, "should not wait for the slow call");
    }

    @Test
    @DisplayName("timeout on every attempt ends in LlmInvocationException caused by LlmTimeoutException")
    void timeoutEverywhere() {
        ModelClient slow = prompt -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new ModelReply("late", TokenUsage.EMPTY);
        };
        var registry = ModelRegistry.builder()
                .register(def("primary"), slow)
                .register(def("fallback"), slow)
                .build();

        var ex = assertThrows(LlmInvocationException.class, () ->
                service(registry, pipeline(0, Duration.ofMillis(50), Map.of()), null)
                        .generate(PipelineStage.PARSE, "prompt"));
        assertInstanceOf(LlmTimeoutException.class, ex.getCause());
    }

    @Test
    @DisplayName("a blank reply counts as a failed attempt")
    void blankReplyFailsAttempt() {
        var calls = new AtomicInteger();
        var registry = ModelRegistry.builder()
                .register(def("primary"), replying(calls, "   "))
                .register(def("fallback"), replying(new AtomicInteger(), "ok"))
                .build();

        LlmResponse response = service(registry, pipeline(0, Duration.ofSeconds(5), Map.of()), null)
                .generate(PipelineStage.PARSE, "prompt");

        assertEquals("fallback", response.modelAlias());
        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("an alias without an initialized provider is skipped as a failed attempt")
    void unavailableProviderFallsBack() {
        var registry = ModelRegistry.builder()
                .registerUnavailable(def("primary"), "missing API key (NOPE)")
                .register(def("fallback"), replying(new AtomicInteger(), "ok"))
                .build();

        LlmResponse response = service(registry, pipeline(0, Duration.ofSeconds(5), Map.of()), null)
                .generate(PipelineStage.PARSE, "prompt");

        assertEquals("fallback", response.modelAlias());
        assertEquals(2, response.attempts());
    }

    @Test
    @DisplayName("usage is forwarded to the cost sink with the model's pricing")
    void forwardsUsageToCostSink() {
        CostSink sink = mock(CostSink.class);
        var registry = ModelRegistry.builder()
                .register(def("primary"), replying(new AtomicInteger(), "ok"))
                .register(def("fallback"), replying(new AtomicInteger(), "ok"))
                .build();

        service(registry, pipeline(0, Duration.ofSeconds(5), Map.of()), sink).generate(PipelineStage.PARSE, "p");

        verify(sink).logCall(PipelineStage.PARSE, "primary", 1000, 500, PRICING);
    }

    @Test
    @DisplayName("a failing cost sink never fails the call")
    void costFailureTolerated() {
        CostSink sink = mock(CostSink.class);
        doThrow(new IllegalStateException("ledger offline"))
                .when(sink).logCall(any(), anyString(), anyLong(), anyLong(), any());
        var primaryCalls = new AtomicInteger();
        var registry = ModelRegistry.builder()
                .register(def("primary"), replying(primaryCalls, "ok"))
                .register(def("fallback"), replying(new AtomicInteger(), "ok"))
                .build();

        LlmResponse response = service(registry, pipeline(2, Duration.ofSeconds(5), Map.of()), sink)
                .generate(PipelineStage.PARSE, "p");

        assertEquals("ok", response.text());
        assertEquals(1, primaryCalls.get());
    }

    @Test
    @DisplayName("a structured reply that does not parse is returned as-is and never retried")
    void unparsableStructuredReplyIsNotRetried() {
        var primaryCalls = new AtomicInteger();
        var fallbackCalls = new AtomicInteger();
        var registry = ModelRegistry.builder()
                .register(def("primary"), replying(primaryCalls, "Sorry, I cannot help with that."))
                .register(def("fallback"), replying(fallbackCalls, "unused"))
                .build();

        LlmResponse response = service(registry, pipeline(2, Duration.ofSeconds(5), Map.of()), null)
                .generate(PipelineStage.CLARIFY, "p", GenerateOptions.structured(ClarificationResponse.class));

        assertEquals("Sorry, I cannot help with that.", response.text());
        assertEquals(1, response.attempts());
        assertEquals(1, primaryCalls.get());
        assertEquals(0, fallbackCalls.get());
    }

    @Test
    @DisplayName("every failed attempt and the fallback are counted per stage and model")
    void recordsAttemptFailuresAndFallback() {
        var meters = new SimpleMeterRegistry();
        var registry = ModelRegistry.builder()
                .register(def("primary"), failing(new AtomicInteger(), "boom"))
                .register(def("fallback"), replying(new AtomicInteger(), "ok"))
                .build();
        service = new LlmService(registry, pipeline(2, Duration.ofSeconds(5), Map.of()), null,
                new AgentOsMetrics(meters));

        service.generate(PipelineStage.PARSE, "p");

        assertEquals(3.0, meters.get("agentos.llm.attempt.failures")
                .tag("stage", "parse").tag("model", "primary").tag("error", "IllegalStateException")
                .counter().count());
        assertEquals(1.0, meters.get("agentos.llm.fallbacks")
                .tag("from", "primary").tag("to", "fallback").counter().count());
        assertEquals(1L, meters.get("agentos.llm.call.duration")
                .tag("model", "fallback").tag("outcome", "success").timer().count());
    }

    @Test
    @DisplayName("structured calls append JSON format instructions to the prompt")
    void appendsFormatInstructions() {
        var seen = new AtomicReference<String>();
        ModelClient capturing = prompt -> {
            seen.set(prompt);
            return new ModelReply("{\"isClearEnough\": true, \"confidence\": 90, \"questions\": []}", TokenUsage.EMPTY);
        };
        var registry = ModelRegistry.builder()
                .register(def("primary"), capturing)
                .register(def("fallback"), capturing)
                .build();

        service(registry, pipeline(0, Duration.ofSeconds(5), Map.of()), null)
                .generate(PipelineStage.CLARIFY, "Assess this", GenerateOptions.structured(ClarificationResponse.class));

        assertTrue(seen.get().startsWith("Assess this"));
        assertTrue(seen.get().contains("JSON"));
        assertTrue(seen.get().contains("isClearEnough"));
    }

    @Test
    @DisplayName("execute stage prefers the model configured for the task type")
    void executeUsesTaskTypeModel() {
        var coderCalls = new AtomicInteger();
        var registry = ModelRegistry.builder()
                .register(def("primary"), replying(new AtomicInteger(), "default"))
                .register(def("fallback"), replying(new AtomicInteger(), "fallback"))
                .register(def("coder"), replying(coderCalls, "code done"))
                .build();

        LlmResponse response = service(registry, pipeline(0, Duration.ofSeconds(5), Map.of("code", "coder")), null)
                .generate(PipelineStage.EXECUTE, "p", GenerateOptions.none().withTaskType("code"));

        assertEquals("coder", response.modelAlias());
        assertEquals(1, coderCalls.get());

        LlmResponse other = service.generate(PipelineStage.EXECUTE, "p", GenerateOptions.none().withTaskType("write"));
        assertEquals("primary", other.modelAlias());
    }
}
