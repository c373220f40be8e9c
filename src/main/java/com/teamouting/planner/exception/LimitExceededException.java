package com.teamouting.planner.exception;

/**
 * Exception thrown when adding date options would exceed the configured per-event maximum.
 *
 * This is a 409 Conflict error indicating the resource state prevents the operation.
 */
public class LimitExceededException extends RuntimeException {

    public LimitExceededException(String message) {
        super(message);
    }

    public LimitExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
