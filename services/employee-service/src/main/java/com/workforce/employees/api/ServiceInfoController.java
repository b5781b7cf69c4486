package com.workforce.employees.api;

import com.workforce.database.migration.MigrationStatusService;
import com.workforce.employees.config.ClockProperties;
import com.workforce.employees.config.EmployeeServiceProperties;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight runtime information: service identity, clock mode and schema version.
 *
 * <p>Actuator's {@code /actuator/info} carries build metadata; this endpoint adds what an operator
 * needs to tell a frozen-clock test deployment from a live one.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final EmployeeServiceProperties properties;
    private final ClockProperties clockProperties;
    private final Clock clock;
    private final ObjectProvider<MigrationStatusService> migrationStatus;

    public ServiceInfoController(
            EmployeeServiceProperties properties,
            ClockProperties clockProperties,
            Clock clock,
            ObjectProvider<MigrationStatusService> migrationStatus) {
        this.properties = properties;
        this.clockProperties = clockProperties;
        this.clock = clock;
        this.migrationStatus = migrationStatus;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", properties.name());
        info.put("environment", properties.environment());
        info.put("description", properties.description() != null ? properties.description() : "");
        info.put("clock", clockProperties.fixed() ? "fixed" : "system");
        MigrationStatusService status = migrationStatus.getIfAvailable();
        if (status != null) {
            info.put("schemaVersion", status.status().currentVersion());
        }
        info.put("status", "running");
        info.put("timestamp", clock.instant().toString());
        return info;
    }
}
