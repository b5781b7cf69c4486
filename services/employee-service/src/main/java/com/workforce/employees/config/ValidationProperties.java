package com.workforce.employees.config;

import com.workforce.validation.ValidationPipeline;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Request validation settings, bound from {@code workforce.validation.*}.
 *
 * @param timeout upper bound on the wait for all rules of one request
 * @param executorThreads size of the pool that runs storage-backed rules
 */
@ConfigurationProperties(prefix = "workforce.validation")
@Validated
public record ValidationProperties(Duration timeout, @Positive Integer executorThreads) {

    public ValidationProperties {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            timeout = ValidationPipeline.DEFAULT_TIMEOUT;
        }
        if (executorThreads == null) {
            executorThreads = 4;
        }
    }
}
