package com.starscape.memora.features.collections.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.starscape.memora.features.collections.domain.Collection;
import com.starscape.memora.features.collections.domain.CollectionUsage;

import java.time.Instant;

/**
 * Collection view. Timestamps are omitted (null) in the list view;
 * {@code bookmarkCount} is only filled in the list view.
 */
public record CollectionResponse(
    String id,
    String name,
    @JsonProperty("isSystem")
    boolean isSystem,
    Long bookmarkCount,
    Instant createdAt,
    Instant updatedAt
) {
    
    public static CollectionResponse from(Collection collection) {
        return new CollectionResponse(
            collection.getCollectionId(),
            collection.getName(),
            collection.isSystem(),
            null,
            collection.getCreatedAt(),
            collection.getUpdatedAt()
        );
    }
    
    public static CollectionResponse from(CollectionUsage usage) {
        return new CollectionResponse(
            usage.collectionId(),
            usage.name(),
            usage.system(),
            usage.bookmarkCount(),
            null,
            null
        );
    }
}
