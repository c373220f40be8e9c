package com.teamouting.planner.model;

/**
 * A participant's stance on a proposed activity.
 */
public enum VoteType {
    FOR,
    AGAINST,
    ABSTAIN
}
