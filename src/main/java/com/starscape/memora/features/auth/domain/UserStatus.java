package com.starscape.memora.features.auth.domain;

public enum UserStatus {
    ACTIVE,
    SUSPENDED
}
