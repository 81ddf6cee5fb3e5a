package com.agentos.core.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Structured goal produced by the parse stage from free text.
 *
 * @param description     restated objective
 * @param successCriteria measurable outcomes
 * @param context         optional background
 * @param priority        low, medium, high or urgent
 */
public record GoalDraft(
    @NotBlank String description,
    @NotNull List<@NotBlank String> successCriteria,
    String context,
    @NotNull Priority priority
) {}
