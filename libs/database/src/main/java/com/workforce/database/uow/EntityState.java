package com.workforce.database.uow;

/**
 * Classification of a registered entity relative to what is stored.
 */
public enum EntityState {

    /** Registered with {@link UnitOfWork#add}; will be inserted. */
    ADDED,

    /** Loaded and tracked, at least one mapped column differs from its snapshot. */
    MODIFIED,

    /** Scheduled for deletion with {@link UnitOfWork#remove}. */
    DELETED,

    /** Loaded and tracked, no mapped column changed. */
    UNCHANGED
}
