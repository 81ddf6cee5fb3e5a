package com.agentos.core.llm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;

import static org.junit.jupiter.api.Assertions.*;

class LlmConfigTest {

    private static final ModelClientFactory FACTORY =
            (alias, model, apiKey) -> prompt -> new ModelReply(alias + ":" + apiKey, TokenUsage.EMPTY);

    private static LlmProperties.Model model(String baseUrl, String apiKey, String apiKeyEnv) {
        var m = new LlmProperties.Model();
        m.setModelId("test-model");
        m.setBaseUrl(baseUrl);
        m.setApiKey(apiKey);
        m.setApiKeyEnv(apiKeyEnv);
        m.getPricing().setInputPer1k(0.5);
        m.getPricing().setOutputPer1k(1.5);
        return m;
    }

    @Test
    @DisplayName("registers a client for every model with a key")
    void registersModels() {
        var props = new LlmProperties();
        var models = new LinkedHashMap<String, LlmProperties.Model>();
        models.put("fast", model("http://localhost:1", "k1", null));
        models.put("smart", model("http://localhost:2", "k2", null));
        props.setModels(models);

        ModelRegistry registry = LlmConfig.buildRegistry(props, FACTORY);

        assertEquals(2, registry.aliases().size());
        assertEquals("fast:k1", registry.client("fast").complete("hi").text());
        assertEquals(new ModelPricing(0.5, 1.5), registry.definition("smart").pricing());
    }

    @Test
    @DisplayName("a model whose key env var is unset stays registered but unavailable")
    void missingKeyIsUnavailable() {
        var props = new LlmProperties();
        props.setModels(new LinkedHashMap<>());
        props.getModels().put("ghost", model("http://localhost", null, "AGENTOS_TEST_KEY_THAT_IS_NEVER_SET"));

        ModelRegistry registry = LlmConfig.buildRegistry(props, FACTORY);

        assertTrue(registry.aliases().contains("ghost"));
        assertFalse(registry.find("ghost").orElseThrow().available());
        var ex = assertThrows(IllegalStateException.class, () -> registry.client("ghost"));
        assertTrue(ex.getMessage().startsWith("Provider not initialized for model ghost"));
    }

    @Test
    @DisplayName("startup validation rejects missing models, base URLs and key sources")
    void validation() {
        var empty = new LlmProperties();
        assertEquals("Config must have at least one model defined",
                assertThrows(IllegalStateException.class, () -> LlmConfig.buildRegistry(empty, FACTORY)).getMessage());

        var noUrl = new LlmProperties();
        noUrl.getModels().put("m", model("", "k", null));
        assertEquals("Model \"m\" is missing required baseUrl",
                assertThrows(IllegalStateException.class, () -> LlmConfig.buildRegistry(noUrl, FACTORY)).getMessage());

        var noKey = new LlmProperties();
        noKey.getModels().put("m", model("http://localhost", null, null));
        assertEquals("Model \"m\" must have either apiKey or apiKeyEnv",
                assertThrows(IllegalStateException.class, () -> LlmConfig.buildRegistry(noKey, FACTORY)).getMessage());
    }
}
