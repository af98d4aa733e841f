package com.di.modelops.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * UTC clock shared by freshness, duplicate-guard windows and job timestamps. Tests pass fixed clocks.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock modelOpsClock() {
        return Clock.systemUTC();
    }
}
