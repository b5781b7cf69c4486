package com.workforce.database.uow;

/**
 * Creates a fresh {@link UnitOfWork} per operation.
 */
@FunctionalInterface
public interface UnitOfWorkFactory {

    UnitOfWork create();
}
