package com.teamouting.planner.model;

/**
 * A participant's availability for a candidate date.
 */
public enum DateResponseType {
    YES,
    MAYBE,
    NO
}
