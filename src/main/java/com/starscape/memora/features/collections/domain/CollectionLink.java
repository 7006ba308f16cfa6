package com.starscape.memora.features.collections.domain;

/**
 * Read model: one bookmark-collection link joined with the collection's name.
 */
public record CollectionLink(
    String bookmarkId,
    String collectionId,
    String name
) {}
