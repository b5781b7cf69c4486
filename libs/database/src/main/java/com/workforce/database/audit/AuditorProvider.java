package com.workforce.database.audit;

/**
 * Resolves the author recorded in audit fields.
 */
@FunctionalInterface
public interface AuditorProvider {

    /** Returns the author name for the current commit. Never {@code null}. */
    String currentAuditor();
}
