package com.starscape.memora.features.tags.domain;

/**
 * Read model: a tag with the number of bookmarks it is applied to.
 */
public record TagUsage(
    String tagId,
    String name,
    long bookmarkCount
) {}
