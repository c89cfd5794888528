package com.example.Botlyne.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(BotlyneProperties.class)
public class OrchestrationConfig {

    /**
     * Single time source for message timestamps and status transitions, replaceable in tests.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
