package com.starscape.memora.features.user.app;

import com.starscape.memora.common.exception.NotFoundException;
import com.starscape.memora.features.auth.domain.User;
import com.starscape.memora.features.auth.domain.UserRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reads and updates the caller's own profile.
 */
@Service
public class UserProfileHandler {
    
    private final UserRepository userRepository;
    
    public UserProfileHandler(UserRepository userRepository) {
        this.userRepository = userRepository;
    }
    
    @Transactional(readOnly = true)
    public User get(String userId) {
        return requireUser(userId);
    }
    
    /**
     * A blank display name clears it.
     */
    @Transactional
    public User updateDisplayName(String userId, String displayName) {
        User user = requireUser(userId);
        user.changeDisplayName(displayName == null || displayName.isBlank() ? null : displayName.trim());
        return userRepository.save(user);
    }
    
    private User requireUser(String userId) {
        // A valid token for a deleted account
        return userRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("user", "User not found."));
    }
}
