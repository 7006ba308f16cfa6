package com.starscape.memora.common.security;

import java.util.Objects;

/**
 * Authenticated caller, built once from the bearer token.
 * Controllers pass {@link #getUserId()} into every owner-scoped operation.
 */
public final class UserPrincipal {
    
    private final String userId;
    private final String email;
    
    public UserPrincipal(String userId, String email) {
        this.userId = Objects.requireNonNull(userId, "userId");
        this.email = email;
    }
    
    public String getUserId() {
        return userId;
    }
    
    public String getEmail() {
        return email;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UserPrincipal other)) return false;
        return userId.equals(other.userId) && Objects.equals(email, other.email);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(userId, email);
    }
    
    @Override
    public String toString() {
        return "UserPrincipal[userId=" + userId + "]";
    }
}
