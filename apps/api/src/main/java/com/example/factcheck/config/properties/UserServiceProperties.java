package com.example.factcheck.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection and caching settings for the accounts service that owns user records.
 * A zero {@code cacheTtl} disables caching of loaded users.
 */
@ConfigurationProperties(prefix = "app.client.user-service")
public record UserServiceProperties(
        String baseUrl,
        Duration timeout,
        Duration cacheTtl,
        int cacheMaxEntries
) {
    public UserServiceProperties {
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = "http://localhost:8081";
        }
        if (timeout == null) {
            timeout = Duration.ofSeconds(2);
        }
        if (cacheTtl == null || cacheTtl.isNegative()) {
            cacheTtl = Duration.ofSeconds(10);
        }
        if (cacheMaxEntries <= 0) {
            cacheMaxEntries = 10000;
        }
    }

    public boolean cacheEnabled() {
        return !cacheTtl.isZero();
    }
}
