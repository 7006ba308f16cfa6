package com.starscape.memora.features.user.api.dto;

import jakarta.validation.constraints.Size;

public record UpdateProfileRequest(
    @Size(max = 100, message = "Display name must be 100 characters or less")
    String displayName
) {}
