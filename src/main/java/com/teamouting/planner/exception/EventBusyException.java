package com.teamouting.planner.exception;

/**
 * Exception thrown when the per-event write lock could not be acquired in time, or when
 * concurrent writers kept invalidating this write. Callers may retry.
 */
public class EventBusyException extends RuntimeException {

    public EventBusyException(String message) {
        super(message);
    }

    public EventBusyException(String message, Throwable cause) {
        super(message, cause);
    }
}
