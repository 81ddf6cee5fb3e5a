package com.agentos.core.model;

import jakarta.validation.constraints.NotBlank;

/**
 * Pointer to something a task produced. Only the location is held, never the content.
 *
 * @param type     kind of artifact, e.g. "file", "url", "document", "code"
 * @param name     display name
 * @param location where the artifact lives
 */
public record Artifact(
    @NotBlank String type,
    @NotBlank String name,
    @NotBlank String location
) {}
