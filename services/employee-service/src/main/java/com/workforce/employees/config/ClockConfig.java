package com.workforce.employees.config;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the single {@link Clock} every time-dependent component reads.
 *
 * <p>Audit stamps, problem timestamps and the info endpoint all take time from this bean, so a
 * frozen clock makes them reproducible. The choice is made once at startup and never changes
 * while the process runs.
 */
@Configuration
@EnableConfigurationProperties(ClockProperties.class)
public class ClockConfig {

    private static final Logger log = LoggerFactory.getLogger(ClockConfig.class);

    @Bean
    public Clock clock(ClockProperties properties) {
        return createClock(properties);
    }

    static Clock createClock(ClockProperties properties) {
        if (properties.fixed()) {
            Instant instant = Instant.parse(properties.fixedInstant().trim());
            log.info("Using fixed clock at {}", instant);
            return Clock.fixed(instant, ZoneOffset.UTC);
        }
        return Clock.systemUTC();
    }
}
