package com.agentos.core.llm;

/**
 * Per-call options for {@link LlmService#generate}.
 *
 * @param modelAlias explicit primary model, overrides stage configuration when set
 * @param taskType   task type used by the execute stage to pick a model
 * @param outputType when set, format instructions for this type are appended to the prompt
 */
public record GenerateOptions(
    String modelAlias,
    String taskType,
    Class<?> outputType
) {

    public static GenerateOptions none() {
        return new GenerateOptions(null, null, null);
    }

    public static GenerateOptions structured(Class<?> outputType) {
        return new GenerateOptions(null, null, outputType);
    }

    public GenerateOptions withTaskType(String taskType) {
        return new GenerateOptions(modelAlias, taskType, outputType);
    }

    public GenerateOptions withModelAlias(String modelAlias) {
        return new GenerateOptions(modelAlias, taskType, outputType);
    }

    public boolean isStructured() {
        return outputType != null;
    }
}
