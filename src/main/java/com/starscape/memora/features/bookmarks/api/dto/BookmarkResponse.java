package com.starscape.memora.features.bookmarks.api.dto;

import com.starscape.memora.features.bookmarks.domain.Bookmark;

import java.time.Instant;
import java.util.List;

/**
 * Bookmark with its tag and collection memberships.
 */
public record BookmarkResponse(
    String id,
    String url,
    String title,
    String description,
    String imageUrl,
    Instant createdAt,
    Instant updatedAt,
    List<TagSummary> tags,
    List<CollectionSummary> collections
) {
    
    public static BookmarkResponse of(Bookmark bookmark, List<TagSummary> tags, List<CollectionSummary> collections) {
        return new BookmarkResponse(
            bookmark.getBookmarkId(),
            bookmark.getUrl(),
            bookmark.getTitle(),
            bookmark.getDescription(),
            bookmark.getImageUrl(),
            bookmark.getCreatedAt(),
            bookmark.getUpdatedAt(),
            tags,
            collections
        );
    }
}
