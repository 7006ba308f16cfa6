package com.starscape.memora.features.bookmarks.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Partial bookmark update. Null scalars are left unchanged.
 * A null or missing list leaves that association untouched; an empty list clears it.
 */
public record UpdateBookmarkRequest(
    @Size(max = 255, message = "Title must be 255 characters or less")
    String title,
    String description,
    String imageUrl,
    List<@Valid TagRef> tags,
    List<CollectionRef> collections
) {}
