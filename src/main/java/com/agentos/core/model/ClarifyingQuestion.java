package com.agentos.core.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * One open question raised by the clarify stage.
 *
 * @param question               the question itself
 * @param blocking               whether work cannot proceed without an answer
 * @param urgency                low, medium or high
 * @param why                    what the answer changes
 * @param assumptionIfUnanswered what will be assumed if nobody answers
 */
public record ClarifyingQuestion(
    @NotBlank String question,
    @NotNull Boolean blocking,
    @NotNull Urgency urgency,
    @NotBlank String why,
    @NotBlank String assumptionIfUnanswered
) {}
