package com.starscape.memora.features.tags.domain;

import java.io.Serializable;
import java.util.Objects;

/**
 * Composite key for BookmarkTag entity.
 */
public class BookmarkTagId implements Serializable {
    
    private String bookmarkId;
    private String tagId;
    
    public BookmarkTagId() {
        // JPA constructor
    }
    
    public BookmarkTagId(String bookmarkId, String tagId) {
        this.bookmarkId = bookmarkId;
        this.tagId = tagId;
    }
    
    public String getBookmarkId() { return bookmarkId; }
    public void setBookmarkId(String bookmarkId) { this.bookmarkId = bookmarkId; }
    
    public String getTagId() { return tagId; }
    public void setTagId(String tagId) { this.tagId = tagId; }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BookmarkTagId that = (BookmarkTagId) o;
        return Objects.equals(bookmarkId, that.bookmarkId) && Objects.equals(tagId, that.tagId);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(bookmarkId, tagId);
    }
}
