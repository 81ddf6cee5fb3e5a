package com.agentos.core.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks model output against an expected Java type: the text must be JSON, must map
 * onto the type without unknown keys, and must satisfy its Bean Validation constraints.
 * <p>
 * Validation and normalization are separate steps; see {@link #readWithRepair}.
 */
@Component
public class StructuredOutputValidator {

    private final ObjectMapper mapper;
    private final Validator validator;
    private final OutputNormalizer normalizer;

    public StructuredOutputValidator(OutputNormalizer normalizer) {
        this(normalizer, Validation.buildDefaultValidatorFactory().getValidator());
    }

    public StructuredOutputValidator(OutputNormalizer normalizer, Validator validator) {
        this.normalizer = normalizer;
        this.validator = validator;
        this.mapper = new ObjectMapper()
                .registerModule(new ParameterNamesModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true)
                .configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);
    }

    /**
     * Single-pass check with no repair.
     */
    public <T> ValidationResult<T> validate(String text, Class<T> type) {
        JsonNode tree;
        try {
            tree = mapper.readTree(stripCodeFence(text));
        } catch (JsonProcessingException e) {
            return ValidationResult.invalid("invalid JSON: " + e.getOriginalMessage());
        }
        return validateTree(tree, type);
    }

    /**
     * Normalization pass: parses the text and applies the configured {@link OutputNormalizer}.
     *
     * @return the normalized JSON text, or {@code null} when the text is not JSON at all
     */
    public String normalize(String text) {
        try {
            JsonNode tree = mapper.readTree(stripCodeFence(text));
            if (tree == null) {
                return null;
            }
            return mapper.writeValueAsString(normalizer.normalize(tree));
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    /**
     * Reads text into {@code type}. When the first validation fails the text is normalized
     * once and revalidated; defaults are never substituted for a bad reply.
     *
     * @throws LlmParseException carrying the original validation error if repair does not help
     */
    public <T> T readWithRepair(String text, Class<T> type) {
        ValidationResult<T> first = validate(text, type);
        if (first.isValid()) {
            return first.value();
        }
        String normalized = normalize(text);
        if (normalized != null) {
            ValidationResult<T> repaired = validate(normalized, type);
            if (repaired.isValid()) {
                return repaired.value();
            }
        }
        throw new LlmParseException("Failed to parse LLM response to " + type.getSimpleName()
                + ": " + first.error(), text);
    }

    private <T> ValidationResult<T> validateTree(JsonNode tree, Class<T> type) {
        if (tree == null || !tree.isObject()) {
            return ValidationResult.invalid("expected a JSON object");
        }
        T value;
        try {
            value = mapper.treeToValue(tree, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            String message = e instanceof JsonProcessingException jpe ? jpe.getOriginalMessage() : e.getMessage();
            return ValidationResult.invalid("schema mismatch: " + message);
        }
        Set<ConstraintViolation<T>> violations = validator.validate(value);
        if (!violations.isEmpty()) {
            String summary = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .collect(Collectors.joining("; "));
            return ValidationResult.invalid("constraint violation: " + summary);
        }
        return ValidationResult.valid(value);
    }

    static String stripCodeFence(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = text.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }
}
