package com.starscape.memora.features.collections.domain;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * A named, user-owned group of bookmarks.
 * Each user has exactly one system collection ("Unsorted") that cannot be renamed or deleted
 * and that receives bookmarks orphaned by a collection delete.
 */
@Entity
@Table(name = "collections", uniqueConstraints = {
    @UniqueConstraint(name = "collections_user_name_unique", columnNames = {"user_id", "name"})
})
public class Collection extends com.starscape.memora.common.domain.Entity<String> {
    
    public static final int MAX_NAME_LENGTH = 100;
    
    @Id
    @Column(name = "collection_id")
    private String collectionId;
    
    @Column(name = "user_id", nullable = false)
    private String userId;
    
    @Column(nullable = false, length = MAX_NAME_LENGTH)
    private String name;
    
    @Column(name = "is_system", nullable = false)
    private boolean system;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    protected Collection() {
        // JPA constructor
    }
    
    private Collection(String collectionId, String userId, String name, boolean system) {
        super(collectionId);
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User ID cannot be blank");
        }
        this.collectionId = collectionId;
        this.userId = userId;
        this.name = validateName(name);
        this.system = system;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }
    
    public static Collection create(String collectionId, String userId, String name) {
        return new Collection(collectionId, userId, name, false);
    }
    
    public static Collection system(String collectionId, String userId, String name) {
        return new Collection(collectionId, userId, name, true);
    }
    
    public void rename(String newName) {
        if (system) {
            throw new IllegalStateException("System collection cannot be renamed");
        }
        this.name = validateName(newName);
        this.updatedAt = Instant.now();
    }
    
    /**
     * Trim a collection name. Case is preserved.
     * 
     * @throws IllegalArgumentException if the name is blank or too long
     */
    public static String validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Collection name is required.");
        }
        String trimmed = name.trim();
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("Collection name must be " + MAX_NAME_LENGTH + " characters or less");
        }
        return trimmed;
    }
    
    @Override
    public String getId() {
        return collectionId;
    }
    
    // Getters
    public String getCollectionId() { return collectionId; }
    public String getUserId() { return userId; }
    public String getName() { return name; }
    public boolean isSystem() { return system; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
