package com.example.main_image_selection.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Source of the run's as-of instant when {@code pipeline.as-of} is not pinned.
 */
@Configuration
class TimeConfig {
    @Bean
    public Clock runClock() {
        return Clock.systemUTC();
    }
}
