package com.starscape.memora.features.auth.domain;

import com.starscape.memora.common.domain.Entity;
import jakarta.persistence.Column;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.Objects;

/**
 * Account owning bookmarks, tags and collections.
 * Holds at most one outstanding password reset, stored as a token hash with an expiry.
 */
@jakarta.persistence.Entity
@Table(name = "users")
public class User extends Entity<String> {
    
    @Id
    @Column(name = "user_id")
    private String userId;
    
    @Column(nullable = false, unique = true)
    private String email;
    
    @Column(name = "password_hash", nullable = false)
    private String passwordHash;
    
    @Column(name = "display_name", length = 100)
    private String displayName;
    
    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private UserStatus status;
    
    @Column(name = "password_reset_token_hash")
    private String passwordResetTokenHash;
    
    @Column(name = "password_reset_expires_at")
    private Instant passwordResetExpiresAt;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    protected User() {
        // JPA constructor
    }
    
    public User(String userId, String email, String passwordHash, String displayName) {
        super(userId);
        this.userId = Objects.requireNonNull(userId);
        this.email = Objects.requireNonNull(email);
        this.passwordHash = Objects.requireNonNull(passwordHash);
        this.displayName = displayName;
        this.status = UserStatus.ACTIVE;
        this.createdAt = Instant.now();
        this.updatedAt = Instant.now();
    }
    
    @Override
    public String getId() {
        return userId;
    }
    
    public String getUserId() {
        return userId;
    }
    
    public String getEmail() {
        return email;
    }
    
    public String getPasswordHash() {
        return passwordHash;
    }
    
    public String getDisplayName() {
        return displayName;
    }
    
    public UserStatus getStatus() {
        return status;
    }
    
    public Instant getCreatedAt() {
        return createdAt;
    }
    
    public Instant getUpdatedAt() {
        return updatedAt;
    }
    
    public void changeDisplayName(String displayName) {
        this.displayName = displayName;
        this.updatedAt = Instant.now();
    }
    
    public void suspend() {
        this.status = UserStatus.SUSPENDED;
        this.updatedAt = Instant.now();
    }
    
    public boolean isActive() {
        return status == UserStatus.ACTIVE;
    }
    
    /**
     * Record a pending password reset, replacing any earlier one.
     */
    public void requestPasswordReset(String tokenHash, Instant expiresAt) {
        this.passwordResetTokenHash = Objects.requireNonNull(tokenHash);
        this.passwordResetExpiresAt = Objects.requireNonNull(expiresAt);
        this.updatedAt = Instant.now();
    }
    
    public boolean hasValidPasswordReset(Instant now) {
        return passwordResetTokenHash != null
                && passwordResetExpiresAt != null
                && passwordResetExpiresAt.isAfter(now);
    }
    
    /**
     * Set a new password hash and clear the pending reset.
     */
    public void resetPassword(String newPasswordHash) {
        this.passwordHash = Objects.requireNonNull(newPasswordHash);
        this.passwordResetTokenHash = null;
        this.passwordResetExpiresAt = null;
        this.updatedAt = Instant.now();
    }
    
    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
