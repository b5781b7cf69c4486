package com.workforce.employees.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ClockConfig")
class ClockConfigTest {

    @Test
    @DisplayName("freezes the clock at the configured instant")
    void fixedClock() {
        Clock clock = ClockConfig.createClock(new ClockProperties("2022-01-01T00:00:00Z"));

        assertThat(clock.instant()).isEqualTo(Instant.parse("2022-01-01T00:00:00Z"));
        assertThat(clock.instant()).isEqualTo(clock.instant());
        assertThat(clock.getZone()).isEqualTo(ZoneOffset.UTC);
    }

    @Test
    @DisplayName("uses the system UTC clock when no instant is configured")
    void systemClock() {
        assertThat(ClockConfig.createClock(new ClockProperties(null))).isEqualTo(Clock.systemUTC());
        assertThat(ClockConfig.createClock(new ClockProperties(" "))).isEqualTo(Clock.systemUTC());
    }

    @Test
    @DisplayName("fails fast on an unparseable instant")
    void rejectsGarbage() {
        assertThatThrownBy(() -> ClockConfig.createClock(new ClockProperties("yesterday")))
                .isInstanceOf(DateTimeParseException.class);
    }
}
