package com.agentos.core.llm;

import java.util.Locale;

/**
 * Named pipeline steps, each with its own invocation configuration.
 */
public enum PipelineStage {
    PARSE,
    CLARIFY,
    DECOMPOSE,
    EXECUTE;

    public String configKey() {
        return name().toLowerCase(Locale.ROOT);
    }
}
