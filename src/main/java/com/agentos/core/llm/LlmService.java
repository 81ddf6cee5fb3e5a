package com.agentos.core.llm;

import com.agentos.core.cost.CostSink;
import com.agentos.core.metrics.AgentOsMetrics;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes one generative call for a pipeline stage with model selection, fallback,
 * retry and timeout.
 * <p>
 * Each candidate model (primary, then fallback) runs under a resilience4j {@link Retry}
 * allowing {@code maxRetries + 1} attempts, and every attempt is bounded by a
 * {@link TimeLimiter} set to the stage timeout. A timed-out call is cancelled with
 * interruption; the HTTP exchange is only aborted if the client honours it, otherwise
 * its result is discarded.
 * <p>
 * Structured calls append JSON-schema format instructions generated by Spring AI's
 * {@link BeanOutputConverter}. The reply is returned as text; callers read it into the
 * expected type with {@link StructuredOutputValidator#readWithRepair}, so a reply that
 * does not parse is never retried here.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final ModelRegistry registry;
    private final PipelineConfig pipelineConfig;
    private final CostSink costSink;
    private final AgentOsMetrics metrics;
    private final ExecutorService callExecutor;
    private final Map<String, Retry> retries = new ConcurrentHashMap<>();
    private final Map<PipelineStage, TimeLimiter> timeLimiters = new ConcurrentHashMap<>();

    public LlmService(ModelRegistry registry,
                      PipelineConfig pipelineConfig,
                      @Autowired(required = false) CostSink costSink,
                      @Autowired(required = false) AgentOsMetrics metrics) {
        this.registry = registry;
        this.pipelineConfig = pipelineConfig;
        this.costSink = costSink;
        this.metrics = metrics;
        this.callExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "llm-call-" + THREAD_COUNTER.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("LlmService initialized with {} model(s): {}", registry.aliases().size(), registry.aliases());
    }

    public LlmResponse generate(PipelineStage stage, String prompt) {
        return generate(stage, prompt, GenerateOptions.none());
    }

    /**
     * Runs the call, trying each candidate model in order.
     *
     * @throws LlmInvocationException once every model/attempt combination has failed;
     *                                its cause is the last error observed
     */
    public LlmResponse generate(PipelineStage stage, String prompt, GenerateOptions options) {
        StageConfig config = pipelineConfig.stage(stage);
        List<String> candidates = pipelineConfig.candidateModels(stage, options);
        String fullPrompt = options.isStructured()
                ? prompt + "\n\n" + new BeanOutputConverter<>(options.outputType()).getFormat()
                : prompt;

        AtomicInteger attempts = new AtomicInteger();
        Exception lastError = null;
        for (int m = 0; m < candidates.size(); m++) {
            String alias = candidates.get(m);
            if (m > 0) {
                log.warn("[{}] falling back from {} to {}", stage.configKey(), candidates.get(m - 1), alias);
                if (metrics != null) {
                    metrics.recordFallback(stage.configKey(), candidates.get(m - 1), alias);
                }
            }
            Callable<LlmResponse> call = Retry.decorateCallable(retryFor(stage, alias, config),
                    () -> attempt(stage, alias, fullPrompt, options, attempts));
            try {
                return call.call();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LlmInvocationException(stage, attempts.get(), e);
            } catch (Exception e) {
                lastError = e;
            }
        }
        log.error("[{}] all {} attempt(s) across {} failed", stage.configKey(), attempts.get(), candidates);
        throw new LlmInvocationException(stage, attempts.get(), lastError);
    }

    private LlmResponse attempt(PipelineStage stage, String alias, String prompt, GenerateOptions options,
                                AtomicInteger attempts) throws Exception {
        int attempt = attempts.incrementAndGet();
        long start = System.currentTimeMillis();
        try {
            ModelReply reply = callWithTimeout(stage, alias, prompt);
            String text = acceptReply(reply, options);
            long elapsed = System.currentTimeMillis() - start;
            log.info("[{}] {} responded on attempt {} ({}s)", stage.configKey(), alias, attempt,
                    String.format("%.1f", elapsed / 1000.0));
            if (metrics != null) {
                metrics.recordLlmCall(stage.configKey(), alias, elapsed, true);
            }
            TokenUsage usage = reply.usage() != null ? reply.usage() : TokenUsage.EMPTY;
            recordCost(stage, alias, usage);
            return new LlmResponse(text, usage, alias, attempt);
        } catch (Exception e) {
            if (metrics != null) {
                metrics.recordLlmCall(stage.configKey(), alias, System.currentTimeMillis() - start, false);
            }
            throw e;
        }
    }

    private ModelReply callWithTimeout(PipelineStage stage, String alias, String prompt) throws Exception {
        ModelClient client = registry.client(alias);
        TimeLimiter limiter = timeLimiterFor(stage);
        try {
            return limiter.executeFutureSupplier(() -> callExecutor.submit(() -> client.complete(prompt)));
        } catch (TimeoutException e) {
            throw new LlmTimeoutException(stage, alias, limiter.getTimeLimiterConfig().getTimeoutDuration());
        }
    }

    private String acceptReply(ModelReply reply, GenerateOptions options) {
        if (reply == null || reply.text() == null || reply.text().isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content"
                    + (options.isStructured() ? " for " + options.outputType().getSimpleName() : ""));
        }
        return reply.text();
    }

    /**
     * One retry instance per stage and model so that attempt events carry both names.
     */
    private Retry retryFor(PipelineStage stage, String alias, StageConfig config) {
        return retries.computeIfAbsent(stage.configKey() + ":" + alias, name -> {
            Retry retry = Retry.of(name, RetryConfig.custom()
                    .maxAttempts(config.attemptsPerModel())
                    .intervalFunction(attempt -> 0L)
                    .ignoreExceptions(InterruptedException.class)
                    .build());
            retry.getEventPublisher()
                    .onRetry(event -> attemptFailed(stage, alias, config, event.getNumberOfRetryAttempts(),
                            event.getLastThrowable()))
                    .onError(event -> attemptFailed(stage, alias, config, event.getNumberOfRetryAttempts(),
                            event.getLastThrowable()));
            return retry;
        });
    }

    private TimeLimiter timeLimiterFor(PipelineStage stage) {
        return timeLimiters.computeIfAbsent(stage, s -> TimeLimiter.of(s.configKey(), TimeLimiterConfig.custom()
                .timeoutDuration(pipelineConfig.stage(s).timeout())
                .cancelRunningFuture(true)
                .build()));
    }

    private void attemptFailed(PipelineStage stage, String alias, StageConfig config, int attempt, Throwable error) {
        log.warn("[{}] model {} attempt {}/{} failed: {}", stage.configKey(), alias, attempt,
                config.attemptsPerModel(), error.getMessage());
        if (metrics != null) {
            metrics.recordAttemptFailure(stage.configKey(), alias, error.getClass().getSimpleName());
        }
    }

    private void recordCost(PipelineStage stage, String alias, TokenUsage usage) {
        try {
            ModelPricing pricing = registry.definition(alias).pricing();
            double cost = pricing.estimateCost(usage.promptTokens(), usage.completionTokens());
            log.info("[{}] {} -> ${} ({}p/{}c)", stage.configKey(), alias, String.format("%.4f", cost),
                    usage.promptTokens(), usage.completionTokens());
            if (metrics != null) {
                metrics.recordCost(stage.configKey(), alias, cost);
            }
            if (costSink != null) {
                costSink.logCall(stage, alias, usage.promptTokens(), usage.completionTokens(), pricing);
            }
        } catch (RuntimeException e) {
            log.warn("[{}] failed to record cost for {}: {}", stage.configKey(), alias, e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        callExecutor.shutdownNow();
    }
}
