package com.example.factcheck.config.properties;

import com.example.factcheck.permissions.policy.PermissionsPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class PermissionsPropertiesTest {

    @Nested
    @DisplayName("PermissionsProperties")
    class Permissions {

        @Test
        @DisplayName("should default to a daily UTC reset and threshold 50")
        void shouldApplyDefaults() {
            PermissionsProperties properties = PermissionsProperties.defaults();

            assertThat(properties.confirmedUserThreshold()).isEqualTo(PermissionsPolicy.DEFAULT_CONFIRMED_USER_THRESHOLD);
            assertThat(properties.reset().enabled()).isTrue();
            assertThat(properties.reset().cron()).isEqualTo("0 0 0 * * *");
            assertThat(properties.reset().zone()).isEqualTo("UTC");
        }

        @Test
        @DisplayName("should keep explicit values")
        void shouldKeepExplicitValues() {
            PermissionsProperties properties = new PermissionsProperties(
                    75,
                    new PermissionsProperties.Reset(false, "0 30 3 * * *", "Europe/Paris"));

            assertThat(properties.confirmedUserThreshold()).isEqualTo(75);
            assertThat(properties.reset().enabled()).isFalse();
            assertThat(properties.reset().cron()).isEqualTo("0 30 3 * * *");
            assertThat(properties.reset().zone()).isEqualTo("Europe/Paris");
        }
    }

    @Nested
    @DisplayName("UserServiceProperties")
    class UserService {

        @Test
        @DisplayName("should fill in missing values")
        void shouldApplyDefaults() {
            UserServiceProperties properties = new UserServiceProperties(null, null, null, 0);

            assertThat(properties.baseUrl()).isEqualTo("http://localhost:8081");
            assertThat(properties.timeout()).isEqualTo(Duration.ofSeconds(2));
            assertThat(properties.cacheTtl()).isEqualTo(Duration.ofSeconds(10));
            assertThat(properties.cacheMaxEntries()).isEqualTo(10000);
            assertThat(properties.cacheEnabled()).isTrue();
        }

        @Test
        @DisplayName("should disable caching with a zero TTL")
        void shouldDisableCaching() {
            UserServiceProperties properties = new UserServiceProperties(
                    "http://users", Duration.ofSeconds(1), Duration.ZERO, 10);

            assertThat(properties.cacheEnabled()).isFalse();
        }
    }
}
