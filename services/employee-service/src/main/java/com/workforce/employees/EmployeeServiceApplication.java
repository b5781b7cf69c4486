package com.workforce.employees;

import com.workforce.employees.config.EmployeeServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Employee records service.
 *
 * <p>Every REST handler is guarded by the request validation aspect, and every write goes through
 * an auditing unit of work. Schema migrations are run by the {@code workforce-database} Flyway
 * bean, so Spring Boot's own Flyway auto-configuration is excluded.
 */
@SpringBootApplication(exclude = FlywayAutoConfiguration.class)
@EnableConfigurationProperties(EmployeeServiceProperties.class)
public class EmployeeServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(EmployeeServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(EmployeeServiceApplication.class, args);
        log.info("Employee service started successfully");
    }
}
