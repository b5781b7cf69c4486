package com.workforce.database.uow;

import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Creates {@link JdbcUnitOfWork} instances sharing one template and transaction manager.
 */
public class JdbcUnitOfWorkFactory implements UnitOfWorkFactory {

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;

    public JdbcUnitOfWorkFactory(NamedParameterJdbcTemplate jdbc, PlatformTransactionManager transactionManager) {
        this.jdbc = jdbc;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public UnitOfWork create() {
        return new JdbcUnitOfWork(jdbc, transactionTemplate);
    }
}
