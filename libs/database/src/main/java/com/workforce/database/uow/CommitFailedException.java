package com.workforce.database.uow;

/**
 * The underlying write of a unit of work failed and the transaction was rolled back.
 */
public class CommitFailedException extends RuntimeException {

    public CommitFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
