package com.starscape.memora.features.auth.app;

import com.starscape.memora.common.config.AccountProperties;
import com.starscape.memora.common.domain.Ids;
import com.starscape.memora.common.exception.ConflictException;
import com.starscape.memora.common.exception.UnauthorizedException;
import com.starscape.memora.common.exception.ValidationException;
import com.starscape.memora.common.security.JwtTokenProvider;
import com.starscape.memora.features.auth.api.dto.LoginRequest;
import com.starscape.memora.features.auth.api.dto.LoginResponse;
import com.starscape.memora.features.auth.api.dto.RegisterRequest;
import com.starscape.memora.features.auth.domain.User;
import com.starscape.memora.features.auth.domain.UserRepository;
import com.starscape.memora.features.collections.app.CollectionStore;
import com.starscape.memora.features.tags.app.TagStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Locale;

@Service
public class AuthService {
    
    private static final Logger log = LoggerFactory.getLogger(AuthService.class);
    
    private static final String INVALID_CREDENTIALS = "Invalid email or password.";
    private static final String INVALID_RESET_TOKEN = "Invalid or expired token.";
    
    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider tokenProvider;
    private final CollectionStore collectionStore;
    private final TagStore tagStore;
    private final PasswordResetNotifier passwordResetNotifier;
    private final AccountProperties accountProperties;
    private final SecureRandom secureRandom = new SecureRandom();
    
    public AuthService(
            UserRepository userRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenProvider tokenProvider,
            CollectionStore collectionStore,
            TagStore tagStore,
            PasswordResetNotifier passwordResetNotifier,
            AccountProperties accountProperties) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.tokenProvider = tokenProvider;
        this.collectionStore = collectionStore;
        this.tagStore = tagStore;
        this.passwordResetNotifier = passwordResetNotifier;
        this.accountProperties = accountProperties;
    }
    
    /**
     * Create an account together with its system collection and default tags.
     */
    @Transactional
    public LoginResponse register(RegisterRequest request) {
        String email = normalizeEmail(request.email());
        if (userRepository.existsByEmail(email)) {
            throw new ConflictException("email", "User with this email already exists.");
        }
        
        String userId = Ids.next(Ids.USER);
        String passwordHash = passwordEncoder.encode(request.password());
        String displayName = request.displayName() == null || request.displayName().isBlank()
                ? null
                : request.displayName().trim();
        
        // Flush so the seeding statements below can reference the user row
        userRepository.saveAndFlush(new User(userId, email, passwordHash, displayName));
        collectionStore.ensureSystemCollection(userId);
        tagStore.seedDefaults(userId);
        
        log.info("User registered: userId={}", userId);
        String token = tokenProvider.generateToken(userId, email);
        return LoginResponse.of(userId, email, token, tokenProvider.getExpirationMs());
    }
    
    @Transactional(readOnly = true)
    public LoginResponse login(LoginRequest request) {
        User user = userRepository.findByEmail(normalizeEmail(request.email()))
                .orElseThrow(() -> new UnauthorizedException(INVALID_CREDENTIALS));
        
        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw new UnauthorizedException(INVALID_CREDENTIALS);
        }
        
        if (!user.isActive()) {
            throw new UnauthorizedException("Account is not active.");
        }
        
        String token = tokenProvider.generateToken(user.getUserId(), user.getEmail());
        return LoginResponse.of(user.getUserId(), user.getEmail(), token, tokenProvider.getExpirationMs());
    }
    
    /**
     * Start a password reset. Unknown emails are ignored silently so the endpoint
     * does not reveal which addresses have accounts.
     */
    @Transactional
    public void forgotPassword(String email) {
        userRepository.findByEmail(normalizeEmail(email)).ifPresentOrElse(user -> {
            String token = newResetToken();
            user.requestPasswordReset(sha256(token), Instant.now().plus(accountProperties.getPasswordResetTtl()));
            userRepository.save(user);
            passwordResetNotifier.sendPasswordReset(
                user.getEmail(),
                user.getDisplayName(),
                accountProperties.getPasswordResetUrl() + "?token=" + token);
        }, () -> log.debug("Password reset requested for unknown email"));
    }
    
    @Transactional
    public void resetPassword(String token, String newPassword) {
        User user = userRepository.findByPasswordResetTokenHash(sha256(token))
                .filter(candidate -> candidate.hasValidPasswordReset(Instant.now()))
                .orElseThrow(() -> new ValidationException("token", INVALID_RESET_TOKEN));
        
        user.resetPassword(passwordEncoder.encode(newPassword));
        userRepository.save(user);
        log.info("Password reset completed: userId={}", user.getUserId());
    }
    
    private String newResetToken() {
        byte[] bytes = new byte[32];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
    
    static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
    
    private static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
