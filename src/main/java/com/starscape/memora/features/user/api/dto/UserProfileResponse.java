package com.starscape.memora.features.user.api.dto;

import com.starscape.memora.features.auth.domain.User;

import java.time.Instant;

public record UserProfileResponse(
    String id,
    String email,
    String displayName,
    Instant createdAt,
    Instant updatedAt
) {
    public static UserProfileResponse from(User user) {
        return new UserProfileResponse(
            user.getUserId(),
            user.getEmail(),
            user.getDisplayName(),
            user.getCreatedAt(),
            user.getUpdatedAt()
        );
    }
}
