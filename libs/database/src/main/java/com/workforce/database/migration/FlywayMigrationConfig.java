package com.workforce.database.migration;

import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Flyway configuration for workforce services.
 *
 * <p>WHY: The migration is declared as an explicit bean with {@code initMethod = "migrate"} so
 * that it runs against the application DataSource before any repository is used, and so that the
 * {@link MigrationStatusService} can report on the same Flyway instance.
 *
 * <h2>Excluding Spring Boot Auto-Configuration</h2>
 *
 * <p>Services importing this configuration should exclude {@link FlywayAutoConfiguration}:
 *
 * <pre>{@code
 * @SpringBootApplication(exclude = FlywayAutoConfiguration.class)
 * }</pre>
 *
 * @see FlywayProperties
 */
@Configuration
@EnableConfigurationProperties(FlywayProperties.class)
@ConditionalOnProperty(prefix = "workforce.flyway", name = "enabled", havingValue = "true", matchIfMissing = true)
public class FlywayMigrationConfig {

    /** Bean name for the service database Flyway instance. */
    public static final String FLYWAY_BEAN = "workforceFlyway";

    /**
     * Creates the Flyway instance for the application DataSource. Migration runs when the bean is
     * initialized.
     *
     * @param dataSource the application DataSource
     * @param properties externalized Flyway configuration
     * @return configured Flyway instance
     */
    @Bean(name = FLYWAY_BEAN, initMethod = "migrate")
    public Flyway workforceFlyway(DataSource dataSource, FlywayProperties properties) {
        return createFlyway(dataSource, properties);
    }

    @Bean
    public MigrationStatusService migrationStatusService(Flyway workforceFlyway) {
        return new MigrationStatusService(workforceFlyway);
    }

    // ── Helpers ──

    /**
     * Creates a configured Flyway instance. Clean is always disabled.
     */
    static Flyway createFlyway(DataSource dataSource, FlywayProperties properties) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(properties.locations().toArray(String[]::new))
                .baselineOnMigrate(properties.baselineOnMigrate())
                .cleanDisabled(true)
                .load();
    }
}
