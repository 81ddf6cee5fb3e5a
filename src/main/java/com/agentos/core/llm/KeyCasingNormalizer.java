package com.agentos.core.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

/**
 * Rewrites object keys to camelCase at every depth: {@code is_clear_enough},
 * {@code is-clear-enough}, {@code IsClearEnough} and {@code IS_CLEAR_ENOUGH} all become
 * {@code isClearEnough}. Values are left untouched.
 */
@Component
public class KeyCasingNormalizer implements OutputNormalizer {

    @Override
    public JsonNode normalize(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isObject()) {
            ObjectNode normalized = JsonNodeFactory.instance.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                var field = fields.next();
                normalized.set(toCamelCase(field.getKey()), normalize(field.getValue()));
            }
            return normalized;
        }
        if (node.isArray()) {
            ArrayNode normalized = JsonNodeFactory.instance.arrayNode();
            for (JsonNode element : node) {
                normalized.add(normalize(element));
            }
            return normalized;
        }
        return node;
    }

    static String toCamelCase(String key) {
        if (key == null || key.isEmpty()) {
            return key;
        }
        String[] parts = key.split("[_\\-\\s]+");
        var sb = new StringBuilder(key.length());
        for (String part : parts) {
            if (part.isEmpty()) {
                continue;
            }
            // all-caps segments (IS_CLEAR) are words, not acronyms to keep
            String word = part.equals(part.toUpperCase(Locale.ROOT)) ? part.toLowerCase(Locale.ROOT) : part;
            if (sb.length() == 0) {
                sb.append(Character.toLowerCase(word.charAt(0))).append(word.substring(1));
            } else {
                sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
            }
        }
        return sb.length() == 0 ? key : sb.toString();
    }
}
