package com.workforce.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link CorrelationContext} record: validates construction, validation rules and MDC
 * key constants.
 */
@DisplayName("CorrelationContext")
class CorrelationContextTest {

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should create context with all fields populated")
        void shouldCreateWithAllFields() {
            var ctx = new CorrelationContext("corr-001", "req-001");

            assertThat(ctx.correlationId()).isEqualTo("corr-001");
            assertThat(ctx.requestId()).isEqualTo("req-001");
        }

        @Test
        @DisplayName("should allow a null requestId")
        void shouldAllowNullRequestId() {
            var ctx = new CorrelationContext("corr-001", null);

            assertThat(ctx.requestId()).isNull();
        }

        @Test
        @DisplayName("should reject null correlationId")
        void shouldRejectNullCorrelationId() {
            assertThatThrownBy(() -> new CorrelationContext(null, "req"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("correlationId");
        }

        @Test
        @DisplayName("should reject blank correlationId")
        void shouldRejectBlankCorrelationId() {
            assertThatThrownBy(() -> new CorrelationContext("   ", "req"))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("MDC key constants match the log pattern")
    void mdcKeys() {
        assertThat(CorrelationContext.MDC_CORRELATION_ID).isEqualTo("correlationId");
        assertThat(CorrelationContext.MDC_REQUEST_ID).isEqualTo("requestId");
    }

    @Test
    @DisplayName("records with equal fields are equal")
    void valueEquality() {
        assertThat(new CorrelationContext("c", "r")).isEqualTo(new CorrelationContext("c", "r"));
    }
}
