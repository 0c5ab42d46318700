package com.example.factcheck;

import com.example.factcheck.config.properties.PermissionsProperties;
import com.example.factcheck.config.properties.UserServiceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({PermissionsProperties.class, UserServiceProperties.class})
public class FactCheckApplication {

    public static void main(String[] args) {
        SpringApplication.run(FactCheckApplication.class, args);
    }

}
