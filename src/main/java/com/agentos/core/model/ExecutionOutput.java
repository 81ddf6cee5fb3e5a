package com.agentos.core.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Execute-stage output before metrics are attached.
 */
public record ExecutionOutput(
    @NotBlank String summary,
    @NotNull List<@Valid @NotNull Artifact> artifacts
) {}
