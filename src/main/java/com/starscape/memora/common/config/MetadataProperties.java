package com.starscape.memora.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for link metadata fetching.
 * Binds to app.metadata.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.metadata")
public class MetadataProperties {
    
    private Duration timeout = Duration.ofSeconds(10);
    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) "
            + "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/114.0.0.0 Safari/537.36";
    private long maxBodyBytes = 2 * 1024 * 1024;
    
    public Duration getTimeout() {
        return timeout;
    }
    
    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }
    
    public String getUserAgent() {
        return userAgent;
    }
    
    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }
    
    public long getMaxBodyBytes() {
        return maxBodyBytes;
    }
    
    public void setMaxBodyBytes(long maxBodyBytes) {
        this.maxBodyBytes = maxBodyBytes;
    }
}
