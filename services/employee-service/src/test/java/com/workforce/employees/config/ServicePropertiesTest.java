package com.workforce.employees.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Configuration properties")
class ServicePropertiesTest {

    @Nested
    @DisplayName("EmployeeServiceProperties")
    class Service {

        @Test
        @DisplayName("accepts valid properties")
        void acceptsValid() {
            var props = new EmployeeServiceProperties("employee-service", "production", "HR");
            assertThat(props.name()).isEqualTo("employee-service");
            assertThat(props.environment()).isEqualTo("production");
            assertThat(props.description()).isEqualTo("HR");
        }

        @Test
        @DisplayName("defaults environment to 'development'")
        void defaultsEnvironment() {
            assertThat(new EmployeeServiceProperties("svc", null, null).environment())
                    .isEqualTo("development");
            assertThat(new EmployeeServiceProperties("svc", " ", null).environment())
                    .isEqualTo("development");
        }
    }

    @Nested
    @DisplayName("ValidationProperties")
    class Validation {

        @Test
        @DisplayName("defaults to a 5 second timeout and 4 threads")
        void defaults() {
            var props = new ValidationProperties(null, null);
            assertThat(props.timeout()).isEqualTo(Duration.ofSeconds(5));
            assertThat(props.executorThreads()).isEqualTo(4);
        }

        @Test
        @DisplayName("replaces a non-positive timeout with the default")
        void replacesNonPositiveTimeout() {
            assertThat(new ValidationProperties(Duration.ZERO, 2).timeout())
                    .isEqualTo(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("keeps explicit values")
        void keepsExplicit() {
            var props = new ValidationProperties(Duration.ofMillis(750), 8);
            assertThat(props.timeout()).isEqualTo(Duration.ofMillis(750));
            assertThat(props.executorThreads()).isEqualTo(8);
        }
    }
}
