package com.workforce.employees.config;

import com.workforce.database.audit.AuditingUnitOfWork;
import com.workforce.database.audit.AuditorProvider;
import com.workforce.database.audit.SystemAuditorProvider;
import com.workforce.database.migration.FlywayMigrationConfig;
import com.workforce.database.uow.JdbcUnitOfWorkFactory;
import com.workforce.database.uow.UnitOfWorkFactory;
import com.workforce.observability.MetricFactory;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * Persistence wiring. Every unit of work handed out by {@link UnitOfWorkFactory} stamps audit
 * fields on commit, using the application {@link Clock}.
 */
@Configuration
@Import(FlywayMigrationConfig.class)
public class PersistenceConfig {

    @Bean
    public AuditorProvider auditorProvider() {
        return new SystemAuditorProvider();
    }

    @Bean
    public UnitOfWorkFactory unitOfWorkFactory(NamedParameterJdbcTemplate jdbc,
                                               PlatformTransactionManager transactionManager,
                                               Clock clock,
                                               AuditorProvider auditorProvider,
                                               MetricFactory metrics) {
        JdbcUnitOfWorkFactory jdbcUnitsOfWork = new JdbcUnitOfWorkFactory(jdbc, transactionManager);
        return () -> new AuditingUnitOfWork(jdbcUnitsOfWork.create(), clock, auditorProvider, metrics);
    }
}
