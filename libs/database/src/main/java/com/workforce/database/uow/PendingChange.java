package com.workforce.database.uow;

/**
 * One registered entity and its state as seen at the time {@link UnitOfWork#pendingChanges()}
 * was called.
 *
 * @param entity the entity instance (the same object the caller registered)
 * @param state  its classification
 */
public record PendingChange(Object entity, EntityState state) {

    public PendingChange {
        if (entity == null) {
            throw new IllegalArgumentException("entity must not be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state must not be null");
        }
    }
}
