package com.invoice.templates.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class EngineConfig {

    // Date sanity checks are relative to "today"; tests pin it with a fixed clock.
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
