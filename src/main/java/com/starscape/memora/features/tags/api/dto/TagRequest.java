package com.starscape.memora.features.tags.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request body for creating or renaming a tag.
 */
public record TagRequest(
    @NotBlank(message = "Tag name is required.")
    @Size(max = 100, message = "Tag name must be 100 characters or less")
    String name
) {}
