package com.workforce.database.uow;

import java.util.List;

/**
 * Transactional boundary across which entity mutations are committed together.
 * <p>
 * Callers register entities, mutate them in memory, and call {@link #commit()} once. Nothing is
 * written before the commit; if the commit fails nothing is written at all.
 * <p>
 * Instances are not thread-safe. Create one per operation through a {@link UnitOfWorkFactory}.
 */
public interface UnitOfWork {

    /**
     * Registers a new entity to be inserted on commit.
     *
     * @return the same entity, for chaining
     */
    <E> E add(E entity, EntityMapping<E> mapping);

    /**
     * Starts tracking a loaded entity. A snapshot of its columns is taken now; the entity is
     * updated on commit only if its columns differ from that snapshot.
     *
     * @return the same entity, for chaining
     */
    <E> E track(E entity, EntityMapping<E> mapping);

    /**
     * Schedules an entity for deletion. Removing an entity that was only added cancels its
     * insertion.
     */
    <E> void remove(E entity, EntityMapping<E> mapping);

    /**
     * Returns every registered entity with its current state, in registration order.
     */
    List<PendingChange> pendingChanges();

    /**
     * Writes all pending changes in one transaction.
     *
     * @return number of rows written
     * @throws CommitFailedException if the write failed; the transaction is rolled back
     */
    int commit();
}
