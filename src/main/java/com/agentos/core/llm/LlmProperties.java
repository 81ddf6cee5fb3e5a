package com.agentos.core.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "agentos.llm")
public class LlmProperties {

    private Map<String, Model> models = new LinkedHashMap<>();
    private Pipeline pipeline = new Pipeline();

    public Map<String, Model> getModels() {
        return models;
    }

    public void setModels(Map<String, Model> models) {
        this.models = models;
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public void setPipeline(Pipeline pipeline) {
        this.pipeline = pipeline;
    }

    public static class Model {
        private String provider = "openai";
        private String modelId = "";
        private String baseUrl = "";
        private String completionsPath = "/v1/chat/completions";
        private String apiKey = "";
        private String apiKeyEnv = "";
        private Pricing pricing = new Pricing();

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public String getModelId() { return modelId; }
        public void setModelId(String modelId) { this.modelId = modelId; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getCompletionsPath() { return completionsPath; }
        public void setCompletionsPath(String completionsPath) { this.completionsPath = completionsPath; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getApiKeyEnv() { return apiKeyEnv; }
        public void setApiKeyEnv(String apiKeyEnv) { this.apiKeyEnv = apiKeyEnv; }
        public Pricing getPricing() { return pricing; }
        public void setPricing(Pricing pricing) { this.pricing = pricing; }

        public boolean hasKeySource() {
            return (apiKey != null && !apiKey.isBlank()) || (apiKeyEnv != null && !apiKeyEnv.isBlank());
        }

        /**
         * Resolves the API key: an explicit key wins, otherwise the named environment variable.
         * Returns an empty string when neither yields a value.
         */
        public String resolveApiKey() {
            if (apiKey != null && !apiKey.isBlank()) {
                return apiKey;
            }
            if (apiKeyEnv != null && !apiKeyEnv.isBlank()) {
                String fromEnv = System.getenv(apiKeyEnv);
                return fromEnv != null ? fromEnv : "";
            }
            return "";
        }
    }

    public static class Pricing {
        private double inputPer1k;
        private double outputPer1k;

        public double getInputPer1k() { return inputPer1k; }
        public void setInputPer1k(double inputPer1k) { this.inputPer1k = inputPer1k; }
        public double getOutputPer1k() { return outputPer1k; }
        public void setOutputPer1k(double outputPer1k) { this.outputPer1k = outputPer1k; }
    }

    public static class Pipeline {
        private Stage parse = new Stage();
        private Stage clarify = new Stage();
        private Stage decompose = new Stage();
        private ExecuteStage execute = new ExecuteStage();

        public Stage getParse() { return parse; }
        public void setParse(Stage parse) { this.parse = parse; }
        public Stage getClarify() { return clarify; }
        public void setClarify(Stage clarify) { this.clarify = clarify; }
        public Stage getDecompose() { return decompose; }
        public void setDecompose(Stage decompose) { this.decompose = decompose; }
        public ExecuteStage getExecute() { return execute; }
        public void setExecute(ExecuteStage execute) { this.execute = execute; }
    }

    public static class Stage {
        private String primary = "";
        private String fallback = "";
        private Duration timeout = Duration.ofSeconds(30);
        private int maxRetries = 2;

        public String getPrimary() { return primary; }
        public void setPrimary(String primary) { this.primary = primary; }
        public String getFallback() { return fallback; }
        public void setFallback(String fallback) { this.fallback = fallback; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    }

    /**
     * The execute stage picks its primary from {@code byType} first, then {@code defaultModel}.
     * Bound from {@code agentos.llm.pipeline.execute.default}.
     */
    public static class ExecuteStage extends Stage {
        private String defaultModel = "";
        private Map<String, String> byType = new LinkedHashMap<>();

        public ExecuteStage() {
            setTimeout(Duration.ofSeconds(60));
        }

        public String getDefault() { return defaultModel; }
        public void setDefault(String defaultModel) { this.defaultModel = defaultModel; }
        public Map<String, String> getByType() { return byType; }
        public void setByType(Map<String, String> byType) { this.byType = byType; }
    }
}
