package com.agentos.core.llm;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable lookup from model alias to its definition and client, built once from
 * configuration and owned by {@link LlmService}.
 * <p>
 * An alias registered without a client is known but unavailable (typically a missing
 * API key); calling it fails that attempt so the caller can move on to the fallback.
 */
public class ModelRegistry {

    /**
     * @param client may be {@code null} when the provider could not be initialized
     */
    public record Entry(ModelDefinition definition, ModelClient client, String unavailableReason) {

        public boolean available() {
            return client != null;
        }
    }

    private final Map<String, Entry> entries;

    private ModelRegistry(Map<String, Entry> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> aliases() {
        return entries.keySet();
    }

    public Collection<Entry> entries() {
        return entries.values();
    }

    public Optional<Entry> find(String alias) {
        return Optional.ofNullable(entries.get(alias));
    }

    /**
     * @throws IllegalStateException if the alias is unknown
     */
    public ModelDefinition definition(String alias) {
        return find(alias).map(Entry::definition)
                .orElseThrow(() -> new IllegalStateException("No model config for alias: " + alias));
    }

    /**
     * @throws IllegalStateException if the alias is unknown or its provider was not initialized
     */
    public ModelClient client(String alias) {
        Entry entry = find(alias)
                .orElseThrow(() -> new IllegalStateException("No model config for alias: " + alias));
        if (!entry.available()) {
            throw new IllegalStateException("Provider not initialized for model " + alias + ": "
                    + entry.unavailableReason());
        }
        return entry.client();
    }

    public static class Builder {
        private final Map<String, Entry> entries = new LinkedHashMap<>();

        public Builder register(ModelDefinition definition, ModelClient client) {
            entries.put(definition.alias(), new Entry(definition, client, null));
            return this;
        }

        public Builder registerUnavailable(ModelDefinition definition, String reason) {
            entries.put(definition.alias(), new Entry(definition, null, reason));
            return this;
        }

        public ModelRegistry build() {
            return new ModelRegistry(entries);
        }
    }
}
