package com.starscape.memora.features.auth.infra;

import com.starscape.memora.features.auth.domain.User;
import com.starscape.memora.features.auth.domain.UserRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface JpaUserRepository extends JpaRepository<User, String>, UserRepository {
    
    @Override
    Optional<User> findByEmail(String email);
    
    @Override
    Optional<User> findByPasswordResetTokenHash(String tokenHash);
    
    @Override
    boolean existsByEmail(String email);
}
