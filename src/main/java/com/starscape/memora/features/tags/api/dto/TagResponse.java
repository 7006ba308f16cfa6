package com.starscape.memora.features.tags.api.dto;

import com.starscape.memora.features.tags.domain.Tag;
import com.starscape.memora.features.tags.domain.TagUsage;

import java.time.Instant;

/**
 * Tag as listed or returned after a write. {@code createdAt} is null in list views
 * and {@code bookmarkCount} is null after writes.
 */
public record TagResponse(
    String id,
    String name,
    Long bookmarkCount,
    Instant createdAt
) {
    
    public static TagResponse from(Tag tag) {
        return new TagResponse(tag.getTagId(), tag.getName(), null, tag.getCreatedAt());
    }
    
    public static TagResponse from(TagUsage usage) {
        return new TagResponse(usage.tagId(), usage.name(), usage.bookmarkCount(), null);
    }
}
