package com.agentos.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

import java.util.Map;

/**
 * Builds the model registry and pipeline configuration from {@link LlmProperties}.
 * <p>
 * Every alias gets its own OpenAI-compatible Spring AI chat model with the alias's
 * base URL and key. Spring AI's internal retry is disabled because {@link LlmService}
 * owns retry and fallback.
 */
@Configuration
public class LlmConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmConfig.class);

    @Bean
    public ModelClientFactory modelClientFactory() {
        return LlmConfig::openAiCompatibleClient;
    }

    @Bean
    public ModelRegistry modelRegistry(LlmProperties properties, ModelClientFactory factory) {
        return buildRegistry(properties, factory);
    }

    @Bean
    public PipelineConfig pipelineConfig(LlmProperties properties, ModelRegistry registry) {
        return PipelineConfig.from(properties.getPipeline(), registry.aliases());
    }

    /**
     * Validates model definitions and binds a client to each alias whose API key resolves.
     *
     * @throws IllegalStateException if no model is configured or a model lacks a base URL or key source
     */
    public static ModelRegistry buildRegistry(LlmProperties properties, ModelClientFactory factory) {
        Map<String, LlmProperties.Model> models = properties.getModels();
        if (models == null || models.isEmpty()) {
            throw new IllegalStateException("Config must have at least one model defined");
        }
        var builder = ModelRegistry.builder();
        models.forEach((alias, model) -> {
            if (model.getBaseUrl() == null || model.getBaseUrl().isBlank()) {
                throw new IllegalStateException("Model \"" + alias + "\" is missing required baseUrl");
            }
            if (!model.hasKeySource()) {
                throw new IllegalStateException("Model \"" + alias + "\" must have either apiKey or apiKeyEnv");
            }
            var definition = new ModelDefinition(alias, model.getProvider(), model.getModelId(), model.getBaseUrl(),
                    new ModelPricing(model.getPricing().getInputPer1k(), model.getPricing().getOutputPer1k()));
            String apiKey = model.resolveApiKey();
            if (apiKey.isBlank()) {
                log.warn("Model {} ({}) has no API key; check env var {}", alias, model.getProvider(), model.getApiKeyEnv());
                builder.registerUnavailable(definition, "missing API key (" + model.getApiKeyEnv() + ")");
                return;
            }
            builder.register(definition, factory.create(alias, model, apiKey));
            log.info("Registered model {} -> {} at {}", alias, model.getModelId(), model.getBaseUrl());
        });
        return builder.build();
    }

    static ModelClient openAiCompatibleClient(String alias, LlmProperties.Model model, String apiKey) {
        OpenAiApi api = OpenAiApi.builder()
                .baseUrl(model.getBaseUrl())
                .completionsPath(model.getCompletionsPath())
                .apiKey(apiKey)
                .build();
        OpenAiChatModel chatModel = OpenAiChatModel.builder()
                .openAiApi(api)
                .defaultOptions(OpenAiChatOptions.builder().model(model.getModelId()).build())
                .retryTemplate(RetryTemplate.builder().maxAttempts(1).build())
                .build();
        return new SpringAiModelClient(alias, ChatClient.create(chatModel));
    }
}
