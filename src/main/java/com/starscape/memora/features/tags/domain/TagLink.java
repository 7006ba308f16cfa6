package com.starscape.memora.features.tags.domain;

/**
 * Read model: one bookmark-tag link joined with the tag's name.
 */
public record TagLink(
    String bookmarkId,
    String tagId,
    String name
) {}
