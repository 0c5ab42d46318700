package com.example.factcheck.config;

import com.example.factcheck.config.properties.PermissionsProperties;
import com.example.factcheck.permissions.policy.PermissionsPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PermissionsConfig {

    @Bean
    public PermissionsPolicy permissionsPolicy(PermissionsProperties properties) {
        return PermissionsPolicy.defaults(properties.confirmedUserThreshold());
    }
}
