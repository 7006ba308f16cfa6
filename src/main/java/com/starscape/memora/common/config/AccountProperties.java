package com.starscape.memora.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for account seeding and password reset.
 * Binds to app.accounts.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.accounts")
public class AccountProperties {
    
    private String systemCollectionName = "Unsorted";
    private List<String> defaultTags = new ArrayList<>(
            List.of("Work", "Personal", "Reading", "Travel", "Food", "Tech", "Finance"));
    private Duration passwordResetTtl = Duration.ofHours(1);
    private String passwordResetUrl = "http://localhost:5173/reset-password";
    
    public String getSystemCollectionName() {
        return systemCollectionName;
    }
    
    public void setSystemCollectionName(String systemCollectionName) {
        this.systemCollectionName = systemCollectionName;
    }
    
    public List<String> getDefaultTags() {
        return defaultTags;
    }
    
    public void setDefaultTags(List<String> defaultTags) {
        this.defaultTags = defaultTags;
    }
    
    public Duration getPasswordResetTtl() {
        return passwordResetTtl;
    }
    
    public void setPasswordResetTtl(Duration passwordResetTtl) {
        this.passwordResetTtl = passwordResetTtl;
    }
    
    public String getPasswordResetUrl() {
        return passwordResetUrl;
    }
    
    public void setPasswordResetUrl(String passwordResetUrl) {
        this.passwordResetUrl = passwordResetUrl;
    }
}
