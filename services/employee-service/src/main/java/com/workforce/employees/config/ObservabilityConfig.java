package com.workforce.employees.config;

import com.workforce.observability.MetricFactory;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ObservabilityConfig {

    @Bean
    public MetricFactory metricFactory(MeterRegistry meterRegistry, EmployeeServiceProperties properties) {
        return new MetricFactory(meterRegistry, properties.name());
    }
}
