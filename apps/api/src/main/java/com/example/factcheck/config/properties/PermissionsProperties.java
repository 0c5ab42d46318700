package com.example.factcheck.config.properties;

import com.example.factcheck.permissions.policy.PermissionsPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration for reputation tiers and the daily quota reset.
 */
@ConfigurationProperties(prefix = "app.permissions")
public record PermissionsProperties(
        Integer confirmedUserThreshold,
        Reset reset
) {
    public record Reset(
            Boolean enabled,
            String cron,
            String zone
    ) {
        public Reset {
            if (enabled == null) {
                enabled = true;
            }
            if (cron == null || cron.isBlank()) {
                cron = "0 0 0 * * *";  // midnight, once a day
            }
            if (zone == null || zone.isBlank()) {
                zone = "UTC";
            }
        }
    }

    public PermissionsProperties {
        if (confirmedUserThreshold == null) {
            confirmedUserThreshold = PermissionsPolicy.DEFAULT_CONFIRMED_USER_THRESHOLD;
        }
        if (reset == null) {
            reset = new Reset(null, null, null);
        }
    }

    public static PermissionsProperties defaults() {
        return new PermissionsProperties(null, null);
    }
}
