package com.workforce.employees.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Clock selection, bound from {@code workforce.clock.*}. Read once at startup.
 *
 * @param fixedInstant ISO-8601 instant to freeze the clock at; the system UTC clock when unset
 */
@ConfigurationProperties(prefix = "workforce.clock")
public record ClockProperties(String fixedInstant) {

    public boolean fixed() {
        return fixedInstant != null && !fixedInstant.isBlank();
    }
}
