package com.teamouting.planner.exception;

/**
 * Exception thrown when an optimistic locking version conflict occurs.
 *
 * This indicates that the event has been modified by another writer since it was last read.
 * The lifecycle service retries these internally and surfaces exhaustion as EventBusyException.
 */
public class VersionConflictException extends RuntimeException {

    public VersionConflictException(String message) {
        super(message);
    }

    public VersionConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
