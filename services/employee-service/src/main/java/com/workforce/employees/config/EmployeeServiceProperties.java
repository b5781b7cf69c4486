package com.workforce.employees.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code workforce.service.*}.
 *
 * <pre>
 * workforce:
 *   service:
 *     name: employee-service
 *     environment: production
 *     description: Employee, user and benefit records
 * </pre>
 *
 * @param name service name used for logging and as the metrics {@code service} tag. Required.
 * @param environment deployment environment, {@code development} when unset
 * @param description human-readable description reported by the info endpoint
 */
@ConfigurationProperties(prefix = "workforce.service")
@Validated
public record EmployeeServiceProperties(@NotBlank String name, String environment, String description) {

    public EmployeeServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
