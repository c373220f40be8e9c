package com.teamouting.planner.exception;

/**
 * Exception thrown for any mutating call on an event whose date has been finalized.
 */
public class EventFinalizedException extends RuntimeException {

    public EventFinalizedException(String message) {
        super(message);
    }

    public EventFinalizedException(String message, Throwable cause) {
        super(message, cause);
    }
}
