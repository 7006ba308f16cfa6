package com.starscape.memora.features.collections.domain;

/**
 * Read model: a collection with its bookmark count.
 */
public record CollectionUsage(
    String collectionId,
    String name,
    boolean system,
    long bookmarkCount
) {}
