package com.agentos.core.llm;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Repairs a structurally correct response whose shape deviates from the expected
 * convention. Must not invent values.
 */
@FunctionalInterface
public interface OutputNormalizer {

    JsonNode normalize(JsonNode node);
}
