package com.cred.freestyle.promotions.exception;

/**
 * Exception thrown when the persistence layer fails to store or remove a promotion.
 *
 * @author Promotions Team
 */
public class DatabaseException extends RuntimeException {

    private final String operation;

    public DatabaseException(String operation, Throwable cause) {
        super(String.format("Database error during %s: %s", operation, cause.getMessage()), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
