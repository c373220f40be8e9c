package com.teamouting.planner.exception;

/**
 * Exception thrown when an activity or date option referenced by a request does not exist
 * within the event's scope.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
