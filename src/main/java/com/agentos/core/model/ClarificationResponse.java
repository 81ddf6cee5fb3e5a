package com.agentos.core.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Raw clarify-stage output.
 */
public record ClarificationResponse(
    @NotNull Boolean isClearEnough,
    @NotNull @Min(0) @Max(100) Integer confidence,
    @NotNull List<@Valid @NotNull ClarifyingQuestion> questions
) {}
