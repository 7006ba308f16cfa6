package com.starscape.memora.features.collections.domain;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Junction entity linking a bookmark to a collection.
 */
@Entity
@Table(name = "bookmark_collections")
@IdClass(BookmarkCollectionId.class)
public class BookmarkCollection {
    
    @Id
    @Column(name = "bookmark_id", nullable = false)
    private String bookmarkId;
    
    @Id
    @Column(name = "collection_id", nullable = false)
    private String collectionId;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    protected BookmarkCollection() {
        // JPA constructor
    }
    
    public BookmarkCollection(String bookmarkId, String collectionId) {
        if (bookmarkId == null || bookmarkId.isBlank()) {
            throw new IllegalArgumentException("Bookmark ID cannot be blank");
        }
        if (collectionId == null || collectionId.isBlank()) {
            throw new IllegalArgumentException("Collection ID cannot be blank");
        }
        this.bookmarkId = bookmarkId;
        this.collectionId = collectionId;
        this.createdAt = Instant.now();
    }
    
    public String getBookmarkId() { return bookmarkId; }
    public String getCollectionId() { return collectionId; }
    public Instant getCreatedAt() { return createdAt; }
}
