package com.starscape.memora.features.bookmarks.domain;

import java.util.Objects;

/**
 * Links a new bookmark starts with. {@code tagId} may be null; a collection is always present.
 */
public record SuggestedDefaults(
    String tagId,
    String collectionId
) {
    
    public SuggestedDefaults {
        Objects.requireNonNull(collectionId, "collectionId");
    }
}
