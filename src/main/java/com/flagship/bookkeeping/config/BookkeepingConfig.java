package com.flagship.bookkeeping.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans.
 *
 * "Today" for due dates and current reports always comes from this clock,
 * so tests can pin it.
 */
@Configuration
public class BookkeepingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
