package com.starscape.memora.features.collections.domain;

import java.io.Serializable;
import java.util.Objects;

/**
 * Composite key for BookmarkCollection entity.
 */
public class BookmarkCollectionId implements Serializable {
    
    private String bookmarkId;
    private String collectionId;
    
    public BookmarkCollectionId() {
        // JPA constructor
    }
    
    public BookmarkCollectionId(String bookmarkId, String collectionId) {
        this.bookmarkId = bookmarkId;
        this.collectionId = collectionId;
    }
    
    public String getBookmarkId() { return bookmarkId; }
    public String getCollectionId() { return collectionId; }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BookmarkCollectionId that)) return false;
        return Objects.equals(bookmarkId, that.bookmarkId) && Objects.equals(collectionId, that.collectionId);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(bookmarkId, collectionId);
    }
}
