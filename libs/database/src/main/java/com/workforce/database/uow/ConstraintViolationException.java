package com.workforce.database.uow;

/**
 * A commit was rejected by a uniqueness or foreign-key constraint.
 * <p>
 * Callers are expected to prevent these before writing, so this signals a programming error
 * rather than bad user input.
 */
public class ConstraintViolationException extends CommitFailedException {

    public ConstraintViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
