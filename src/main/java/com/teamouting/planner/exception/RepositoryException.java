package com.teamouting.planner.exception;

/**
 * Exception thrown when a persistence call fails for reasons other than a version conflict.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
