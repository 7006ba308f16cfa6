package com.starscape.memora.features.auth.app;

/**
 * Outbound port for delivering password reset links.
 */
public interface PasswordResetNotifier {
    
    /**
     * @param email       recipient address
     * @param displayName recipient name, may be null
     * @param resetUrl    link carrying the one-time reset token
     */
    void sendPasswordReset(String email, String displayName, String resetUrl);
}
