package com.starscape.memora.features.auth.domain;

import java.util.Optional;

public interface UserRepository {
    User save(User user);
    User saveAndFlush(User user);
    Optional<User> findById(String userId);
    Optional<User> findByEmail(String email);
    Optional<User> findByPasswordResetTokenHash(String tokenHash);
    boolean existsByEmail(String email);
}
