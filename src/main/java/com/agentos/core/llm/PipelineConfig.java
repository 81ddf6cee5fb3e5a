package com.agentos.core.llm;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Invocation settings for every pipeline stage, resolved into candidate model lists.
 */
public class PipelineConfig {

    private final Map<PipelineStage, StageConfig> stages;

    public PipelineConfig(Map<PipelineStage, StageConfig> stages) {
        var copy = new EnumMap<PipelineStage, StageConfig>(PipelineStage.class);
        copy.putAll(stages);
        for (PipelineStage stage : PipelineStage.values()) {
            if (!copy.containsKey(stage)) {
                throw new IllegalArgumentException("Missing pipeline configuration for stage " + stage.configKey());
            }
        }
        this.stages = copy;
    }

    /**
     * Builds the pipeline from bound properties, checking every alias against {@code knownModels}.
     *
     * @throws IllegalStateException naming the first stage that references an unknown model
     */
    public static PipelineConfig from(LlmProperties.Pipeline pipeline, Set<String> knownModels) {
        var stages = new EnumMap<PipelineStage, StageConfig>(PipelineStage.class);
        stages.put(PipelineStage.PARSE, core(PipelineStage.PARSE, pipeline.getParse(), knownModels));
        stages.put(PipelineStage.CLARIFY, core(PipelineStage.CLARIFY, pipeline.getClarify(), knownModels));
        stages.put(PipelineStage.DECOMPOSE, core(PipelineStage.DECOMPOSE, pipeline.getDecompose(), knownModels));

        LlmProperties.ExecuteStage execute = pipeline.getExecute();
        requireKnown(knownModels, execute.getDefault(), "Pipeline stage execute references unknown default model: ");
        requireKnownIfSet(knownModels, execute.getFallback(), "Pipeline stage execute references unknown fallback model: ");
        execute.getByType().forEach((type, alias) -> requireKnown(knownModels, alias,
                "Pipeline stage execute.byType[\"" + type + "\"] references unknown model: "));
        stages.put(PipelineStage.EXECUTE, new StageConfig(PipelineStage.EXECUTE, execute.getDefault(),
                execute.getFallback(), execute.getTimeout(), execute.getMaxRetries(), execute.getByType()));
        return new PipelineConfig(stages);
    }

    private static StageConfig core(PipelineStage stage, LlmProperties.Stage props, Set<String> knownModels) {
        requireKnown(knownModels, props.getPrimary(),
                "Pipeline stage " + stage.configKey() + " references unknown model: ");
        requireKnownIfSet(knownModels, props.getFallback(),
                "Pipeline stage " + stage.configKey() + " references unknown fallback model: ");
        return new StageConfig(stage, props.getPrimary(), props.getFallback(), props.getTimeout(),
                props.getMaxRetries(), Map.of());
    }

    private static void requireKnown(Set<String> knownModels, String alias, String message) {
        if (alias == null || !knownModels.contains(alias)) {
            throw new IllegalStateException(message + alias);
        }
    }

    private static void requireKnownIfSet(Set<String> knownModels, String alias, String message) {
        if (alias != null && !alias.isBlank()) {
            requireKnown(knownModels, alias, message);
        }
    }

    public StageConfig stage(PipelineStage stage) {
        return stages.get(stage);
    }

    /**
     * Ordered candidate models for a call: the primary (explicit override, then the
     * execute stage's per-type model, then the stage primary), followed by the fallback
     * when it differs from the primary.
     */
    public List<String> candidateModels(PipelineStage stage, GenerateOptions options) {
        StageConfig config = stages.get(stage);
        String primary = config.primary();
        if (options.modelAlias() != null && !options.modelAlias().isBlank()) {
            primary = options.modelAlias();
        } else if (stage == PipelineStage.EXECUTE && options.taskType() != null) {
            primary = config.modelsByType().getOrDefault(options.taskType(), config.primary());
        }
        var candidates = new ArrayList<String>(2);
        candidates.add(primary);
        if (config.fallback() != null && !config.fallback().equals(primary)) {
            candidates.add(config.fallback());
        }
        return candidates;
    }
}
