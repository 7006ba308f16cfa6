package com.starscape.memora.features.bookmarks.api.dto;

import jakarta.validation.constraints.Size;

/**
 * Reference to a tag in a bookmark update: an owned id, or a name to find or create.
 */
public record TagRef(
    String id,
    @Size(max = 100, message = "Tag name must be 100 characters or less")
    String name
) {}
