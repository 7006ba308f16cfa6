package com.starscape.memora.features.bookmarks.domain;

/**
 * Read model: bookmark id and title, used where full bookmark views are not needed.
 */
public record BookmarkSummary(
    String id,
    String title
) {}
