package com.csd.repocleaner.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(CleanerProperties.class)
public class CleanerConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
