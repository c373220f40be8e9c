package com.teamouting.planner.exception;

/**
 * Exception thrown when an operation or transition is not permitted in the event's current phase,
 * for example voting on an activity after scheduling has begun.
 */
public class InvalidPhaseTransitionException extends RuntimeException {

    public InvalidPhaseTransitionException(String message) {
        super(message);
    }

    public InvalidPhaseTransitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
