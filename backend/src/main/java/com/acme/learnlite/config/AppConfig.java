package com.acme.learnlite.config;

import com.acme.learnlite.security.JwtProperties;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@ConfigurationPropertiesScan(basePackageClasses = JwtProperties.class)
public class AppConfig {
    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
