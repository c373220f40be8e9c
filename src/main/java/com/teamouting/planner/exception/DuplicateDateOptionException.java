package com.teamouting.planner.exception;

/**
 * Exception thrown when a date option with the same date and start time already exists,
 * or appears twice in the same batch.
 */
public class DuplicateDateOptionException extends RuntimeException {

    public DuplicateDateOptionException(String message) {
        super(message);
    }

    public DuplicateDateOptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
