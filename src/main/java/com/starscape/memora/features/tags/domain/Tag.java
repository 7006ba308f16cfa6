package com.starscape.memora.features.tags.domain;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.Locale;

/**
 * Tag entity representing a user-created tag.
 * Tags are user-specific and can be applied to multiple bookmarks.
 * Names are stored normalized, so (user, name) is the uniqueness key.
 */
@Entity
@Table(name = "tags", uniqueConstraints = {
    @UniqueConstraint(name = "tags_user_name_unique", columnNames = {"user_id", "name"})
})
public class Tag extends com.starscape.memora.common.domain.Entity<String> {
    
    public static final int MAX_NAME_LENGTH = 100;
    
    @Id
    @Column(name = "tag_id")
    private String tagId;
    
    @Column(name = "user_id", nullable = false)
    private String userId;
    
    @Column(nullable = false, length = MAX_NAME_LENGTH)
    private String name;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    protected Tag() {
        // JPA constructor
    }
    
    public Tag(String tagId, String userId, String name) {
        super(tagId);
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID cannot be blank");
        }
        this.tagId = tagId;
        this.userId = userId;
        this.name = normalizeName(name);
        this.createdAt = Instant.now();
    }
    
    /**
     * Normalize tag name: trim whitespace and convert to lowercase.
     * 
     * @throws IllegalArgumentException if the name is blank or too long
     */
    public static String normalizeName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tag name cannot be blank");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        if (normalized.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("Tag name must be " + MAX_NAME_LENGTH + " characters or less");
        }
        return normalized;
    }
    
    public void rename(String newName) {
        this.name = normalizeName(newName);
    }
    
    @Override
    public String getId() {
        return tagId;
    }
    
    // Getters
    public String getTagId() { return tagId; }
    public String getUserId() { return userId; }
    public String getName() { return name; }
    public Instant getCreatedAt() { return createdAt; }
}
