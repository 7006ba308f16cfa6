package com.starscape.memora.common.config;

import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Outbound HTTP client used for fetching bookmarked pages.
 * The call timeout bounds the whole request, including redirects and body read.
 */
@Configuration
public class HttpClientConfig {
    
    @Bean
    public OkHttpClient metadataHttpClient(MetadataProperties properties) {
        return new OkHttpClient.Builder()
                .connectTimeout(properties.getTimeout())
                .readTimeout(properties.getTimeout())
                .callTimeout(properties.getTimeout())
                .followRedirects(true)
                .followSslRedirects(true)
                .build();
    }
}
