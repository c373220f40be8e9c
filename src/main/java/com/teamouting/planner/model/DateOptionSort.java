package com.teamouting.planner.model;

public enum DateOptionSort {
    SCORE,
    CHRONOLOGICAL
}
