package com.teamouting.planner.model;

/**
 * Stage of an outing event. Declaration order is the lifecycle order.
 */
public enum EventPhase {
    PROPOSAL,
    VOTING,
    SCHEDULING,
    INFO;

    public boolean isBefore(EventPhase other) {
        return this.ordinal() < other.ordinal();
    }

    public boolean isTerminal() {
        return this == INFO;
    }
}
