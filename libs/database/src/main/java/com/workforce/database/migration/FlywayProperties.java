package com.workforce.database.migration;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized Flyway configuration for the service database.
 *
 * <p>WHY: Migrations run on the application's own DataSource, so only the switch and the script
 * locations are configurable. Bean Validation fails startup on an empty location list rather than
 * silently migrating nothing.
 *
 * <h2>Configuration Example</h2>
 *
 * <pre>{@code
 * workforce:
 *   flyway:
 *     enabled: true
 *     locations: classpath:db/migration
 * }</pre>
 *
 * @param enabled whether to migrate on startup (default {@code true})
 * @param locations Flyway migration locations (default {@code classpath:db/migration})
 * @param baselineOnMigrate baseline a non-empty schema that has no history table (default {@code
 *     true})
 */
@Validated
@ConfigurationProperties(prefix = "workforce.flyway")
public record FlywayProperties(Boolean enabled, @NotEmpty List<String> locations, Boolean baselineOnMigrate) {

    /** Default migration location. */
    public static final String DEFAULT_LOCATION = "classpath:db/migration";

    public FlywayProperties {
        if (enabled == null) {
            enabled = Boolean.TRUE;
        }
        if (locations == null || locations.isEmpty()) {
            locations = List.of(DEFAULT_LOCATION);
        }
        if (baselineOnMigrate == null) {
            baselineOnMigrate = Boolean.TRUE;
        }
    }
}
