package com.agentos.core.llm;

import com.agentos.core.model.ClarificationResponse;
import com.agentos.core.model.DecompositionPlan;
import com.agentos.core.model.GoalDraft;
import com.agentos.core.model.Priority;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StructuredOutputValidatorTest {

    private final StructuredOutputValidator validator = new StructuredOutputValidator(new KeyCasingNormalizer());

    @Nested
    @DisplayName("validate")
    class Validate {

        @Test
        @DisplayName("accepts a well-formed goal draft")
        void acceptsGoalDraft() {
            var result = validator.validate("""
                    {"description": "Ship v2", "successCriteria": ["tests pass"], "priority": "high"}
                    """, GoalDraft.class);
            assertTrue(result.isValid());
            assertEquals(Priority.HIGH, result.value().priority());
            assertNull(result.value().context());
        }

        @Test
        @DisplayName("strips a markdown code fence")
        void stripsCodeFence() {
            var result = validator.validate("""
                    ```json
                    {"description": "Ship v2", "successCriteria": [], "priority": "low"}
                    ```
                    """, GoalDraft.class);
            assertTrue(result.isValid(), result.error());
        }

        @Test
        @DisplayName("rejects text that is not JSON")
        void rejectsNonJson() {
            var result = validator.validate("Sure! Here is the plan.", GoalDraft.class);
            assertFalse(result.isValid());
            assertTrue(result.error().startsWith("invalid JSON"));
        }

        @Test
        @DisplayName("rejects a JSON array where an object is expected")
        void rejectsArray() {
            var result = validator.validate("[1, 2]", GoalDraft.class);
            assertEquals("expected a JSON object", result.error());
        }

        @Test
        @DisplayName("rejects an enum value outside the domain")
        void rejectsUnknownPriority() {
            var result = validator.validate("""
                    {"description": "x", "successCriteria": [], "priority": "whenever"}
                    """, GoalDraft.class);
            assertFalse(result.isValid());
            assertTrue(result.error().startsWith("schema mismatch"), result.error());
        }

        @Test
        @DisplayName("reports constraint violations such as confidence above 100")
        void rejectsOutOfRangeConfidence() {
            var result = validator.validate("""
                    {"isClearEnough": true, "confidence": 140, "questions": []}
                    """, ClarificationResponse.class);
            assertFalse(result.isValid());
            assertTrue(result.error().contains("confidence"), result.error());
        }

        @Test
        @DisplayName("rejects a decomposition with more than ten tasks")
        void rejectsTooManyTasks() {
            var tasks = new StringBuilder();
            for (int i = 0; i < 11; i++) {
                if (i > 0) {
                    tasks.append(",");
                }
                tasks.append("{\"description\":\"t").append(i)
                        .append("\",\"type\":\"code\",\"requiredCapabilities\":[],\"dependencies\":[]}");
            }
            var result = validator.validate("{\"tasks\":[" + tasks + "],\"strategy\":\"s\"}", DecompositionPlan.class);
            assertFalse(result.isValid());
            assertTrue(result.error().contains("tasks"), result.error());
        }
    }

    @Nested
    @DisplayName("readWithRepair")
    class Repair {

        @Test
        @DisplayName("reads the value once the key casing has been normalized")
        void repairsCasing() {
            ClarificationResponse response = validator.readWithRepair("""
                    {"IS_CLEAR_ENOUGH": false, "Confidence": 40, "questions": [
                      {"question": "Which region?", "blocking": true, "urgency": "high",
                       "why": "latency", "assumption-if-unanswered": "eu-west"}
                    ]}
                    """, ClarificationResponse.class);

            assertFalse(response.isClearEnough());
            assertEquals("eu-west", response.questions().get(0).assumptionIfUnanswered());
        }

        @Test
        @DisplayName("propagates the original error when normalization does not help")
        void keepsOriginalError() {
            var ex = assertThrows(LlmParseException.class, () ->
                    validator.readWithRepair("{\"description\": \"\", \"successCriteria\": [], \"priority\": \"low\"}",
                            GoalDraft.class));
            assertTrue(ex.getMessage().contains("constraint violation"), ex.getMessage());
            assertTrue(ex.getMessage().contains("description"), ex.getMessage());
        }
    }

    @Test
    @DisplayName("readWithRepair fails loudly with a 200 character excerpt of the response")
    void readCarriesExcerpt() {
        String garbage = "x".repeat(500);
        var ex = assertThrows(LlmParseException.class, () -> validator.readWithRepair(garbage, GoalDraft.class));
        assertEquals(200, ex.getResponseExcerpt().length());
    }

    @Test
    @DisplayName("key casing normalizer converts common conventions to camelCase")
    void camelCases() {
        assertEquals("isClearEnough", KeyCasingNormalizer.toCamelCase("is_clear_enough"));
        assertEquals("isClearEnough", KeyCasingNormalizer.toCamelCase("is-clear-enough"));
        assertEquals("isClearEnough", KeyCasingNormalizer.toCamelCase("IsClearEnough"));
        assertEquals("isClearEnough", KeyCasingNormalizer.toCamelCase("IS_CLEAR_ENOUGH"));
        assertEquals("confidence", KeyCasingNormalizer.toCamelCase("confidence"));
    }
}
