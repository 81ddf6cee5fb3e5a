package com.agentos.core.llm;

/**
 * Creates the client for one configured model alias.
 */
@FunctionalInterface
public interface ModelClientFactory {

    ModelClient create(String alias, LlmProperties.Model model, String apiKey);
}
