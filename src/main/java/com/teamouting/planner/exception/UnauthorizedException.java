package com.teamouting.planner.exception;

/**
 * Exception thrown when the caller is not a participant of the event, or attempts an
 * organizer-only action without being an organizer.
 */
public class UnauthorizedException extends RuntimeException {

    public UnauthorizedException(String message) {
        super(message);
    }

    public UnauthorizedException(String message, Throwable cause) {
        super(message, cause);
    }
}
