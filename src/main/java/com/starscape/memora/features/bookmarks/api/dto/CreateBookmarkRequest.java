package com.starscape.memora.features.bookmarks.api.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Request body for saving a URL. {@code url} is kept as a raw JSON node so that
 * non-string values can be rejected with a field-level error instead of being coerced.
 */
public record CreateBookmarkRequest(
    JsonNode url
) {}
