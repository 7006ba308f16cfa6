package com.starscape.memora.features.tags.api.dto;

import com.starscape.memora.features.bookmarks.domain.BookmarkSummary;
import com.starscape.memora.features.tags.app.TagDetails;

import java.time.Instant;
import java.util.List;

public record TagDetailResponse(
    String id,
    String name,
    Instant createdAt,
    List<BookmarkSummary> bookmarks
) {
    
    public static TagDetailResponse from(TagDetails details) {
        return new TagDetailResponse(
            details.tag().getTagId(),
            details.tag().getName(),
            details.tag().getCreatedAt(),
            details.bookmarks()
        );
    }
}
