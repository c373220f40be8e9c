package com.teamouting.planner.model;

/**
 * Vote counts for one proposed activity. Abstentions are counted but never affect {@link #net()}.
 */
public record ActivityTally(String activityId, int forCount, int againstCount, int abstainCount) {

    public int net() {
        return forCount - againstCount;
    }
}
