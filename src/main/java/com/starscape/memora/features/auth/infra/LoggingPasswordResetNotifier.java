package com.starscape.memora.features.auth.infra;

import com.starscape.memora.features.auth.app.PasswordResetNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default notifier: writes the reset link to the log instead of sending mail.
 * The link itself is only logged at DEBUG since it carries a live token.
 */
@Component
public class LoggingPasswordResetNotifier implements PasswordResetNotifier {
    
    private static final Logger log = LoggerFactory.getLogger(LoggingPasswordResetNotifier.class);
    
    @Override
    public void sendPasswordReset(String email, String displayName, String resetUrl) {
        log.info("Password reset requested for {}", email);
        log.debug("Password reset link for {}: {}", email, resetUrl);
    }
}
