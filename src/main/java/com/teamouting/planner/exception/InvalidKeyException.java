package com.teamouting.planner.exception;

/**
 * Exception thrown when DynamoDB key validation fails.
 * Used by OutingKeyFactory to reject malformed identifiers before they reach the table.
 */
public class InvalidKeyException extends ValidationException {

    public InvalidKeyException(String message) {
        super(message);
    }

    public InvalidKeyException(String message, Throwable cause) {
        super(message, cause);
    }
}
