package com.starscape.memora.features.collections.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request body for creating or renaming a collection.
 */
public record CollectionRequest(
    @NotBlank(message = "Collection name is required.")
    @Size(max = 100, message = "Collection name must be 100 characters or less")
    String name
) {}
