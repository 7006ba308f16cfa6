package com.starscape.memora.features.bookmarks.domain;

import com.starscape.memora.common.domain.Entity;
import jakarta.persistence.Column;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;

/**
 * A saved URL owned by one user. (user, url) is unique.
 * Tag and collection membership lives in the junction tables, not on this entity.
 */
@jakarta.persistence.Entity
@Table(name = "bookmarks", uniqueConstraints = {
    @UniqueConstraint(name = "bookmarks_user_url_unique", columnNames = {"user_id", "url"})
})
public class Bookmark extends Entity<String> {
    
    public static final int FALLBACK_TITLE_LENGTH = 100;
    
    @Id
    @Column(name = "bookmark_id")
    private String bookmarkId;
    
    @Column(name = "user_id", nullable = false)
    private String userId;
    
    @Column(nullable = false, columnDefinition = "TEXT")
    private String url;
    
    @Column(nullable = false, length = 255)
    private String title;
    
    @Column(columnDefinition = "TEXT")
    private String description;
    
    @Column(name = "image_url", columnDefinition = "TEXT")
    private String imageUrl;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    protected Bookmark() {
        // JPA constructor
    }
    
    public Bookmark(String bookmarkId, String userId, String url, String title, String description, String imageUrl) {
        super(bookmarkId);
        validateInput(userId, url);
        this.bookmarkId = bookmarkId;
        this.userId = userId;
        this.url = url;
        this.title = title == null || title.isBlank() ? fallbackTitle(url) : title;
        this.description = description;
        this.imageUrl = imageUrl;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }
    
    private void validateInput(String userId, String url) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID cannot be blank");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("URL cannot be blank");
        }
    }
    
    /**
     * Title used when the page offered none: the leading characters of the URL.
     */
    public static String fallbackTitle(String url) {
        return url.substring(0, Math.min(FALLBACK_TITLE_LENGTH, url.length()));
    }
    
    /**
     * Apply a partial update. Null arguments leave the field unchanged.
     */
    public void patch(String title, String description, String imageUrl) {
        if (title != null) {
            this.title = title;
        }
        if (description != null) {
            this.description = description;
        }
        if (imageUrl != null) {
            this.imageUrl = imageUrl;
        }
        touch();
    }
    
    public void touch() {
        this.updatedAt = Instant.now();
    }
    
    @Override
    public String getId() {
        return bookmarkId;
    }
    
    // Getters
    public String getBookmarkId() { return bookmarkId; }
    public String getUserId() { return userId; }
    public String getUrl() { return url; }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public String getImageUrl() { return imageUrl; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
