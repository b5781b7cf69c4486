package com.workforce.database.migration;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.MigrationInfoService;

/**
 * Reports the migration state of the service database.
 *
 * <p>This is a POJO (no Spring annotations) so it can be used from unit tests with a hand-built
 * Flyway instance; {@link FlywayMigrationConfig} registers it as a bean.
 */
public class MigrationStatusService {

    /**
     * One applied migration.
     *
     * @param version migration version (e.g., "1", "1000")
     * @param description migration description (e.g., "initial schema")
     * @param state migration state (e.g., "SUCCESS")
     * @param installedOn when the migration was applied
     */
    public record AppliedMigration(String version, String description, String state, Instant installedOn) {}

    /**
     * Overall migration state.
     *
     * @param appliedMigrations number of applied migrations
     * @param pendingMigrations number of migrations waiting to be applied
     * @param currentVersion current schema version (null if no migration applied)
     */
    public record SchemaStatus(int appliedMigrations, int pendingMigrations, String currentVersion) {}

    private final Flyway flyway;

    public MigrationStatusService(Flyway flyway) {
        this.flyway = flyway;
    }

    /**
     * Returns the current migration state.
     */
    public SchemaStatus status() {
        MigrationInfoService info = flyway.info();
        MigrationInfo current = info.current();
        return new SchemaStatus(
                info.applied().length,
                info.pending().length,
                current == null || current.getVersion() == null ? null : current.getVersion().getVersion());
    }

    /**
     * Returns the applied migrations, oldest first.
     */
    public List<AppliedMigration> appliedMigrations() {
        return Arrays.stream(flyway.info().applied())
                .map(m -> new AppliedMigration(
                        m.getVersion() == null ? null : m.getVersion().getVersion(),
                        m.getDescription(),
                        m.getState().name(),
                        m.getInstalledOn() == null ? null : m.getInstalledOn().toInstant()))
                .toList();
    }
}
