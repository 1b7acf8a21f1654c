package com.williamcallahan.inference.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Shared infrastructure for the resilience layer: the time source and background scheduling.
 */
@Configuration
@EnableScheduling
public class ResilienceConfig {

    /**
     * Wall clock used for rate windows, breaker timeouts, cache expiry and health timestamps.
     *
     * @return UTC system clock
     */
    @Bean
    public Clock inferenceClock() {
        return Clock.systemUTC();
    }
}
