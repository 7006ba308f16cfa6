package com.starscape.memora.features.tags.domain;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Junction entity for the many-to-many relationship between bookmarks and tags.
 */
@Entity
@Table(name = "bookmark_tags")
@IdClass(BookmarkTagId.class)
public class BookmarkTag {
    
    @Id
    @Column(name = "bookmark_id", nullable = false)
    private String bookmarkId;
    
    @Id
    @Column(name = "tag_id", nullable = false)
    private String tagId;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    protected BookmarkTag() {
        // JPA constructor
    }
    
    public BookmarkTag(String bookmarkId, String tagId) {
        if (bookmarkId == null || bookmarkId.isBlank()) {
            throw new IllegalArgumentException("Bookmark ID cannot be blank");
        }
        if (tagId == null || tagId.isBlank()) {
            throw new IllegalArgumentException("Tag ID cannot be blank");
        }
        
        this.bookmarkId = bookmarkId;
        this.tagId = tagId;
        this.createdAt = Instant.now();
    }
    
    // Getters
    public String getBookmarkId() { return bookmarkId; }
    public String getTagId() { return tagId; }
    public Instant getCreatedAt() { return createdAt; }
}
