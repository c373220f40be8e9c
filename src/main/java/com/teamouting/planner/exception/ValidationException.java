package com.teamouting.planner.exception;

/**
 * Exception thrown when request input is malformed, e.g. an end time without a start time.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
