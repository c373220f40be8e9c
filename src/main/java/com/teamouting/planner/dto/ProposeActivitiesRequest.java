package com.teamouting.planner.dto;

import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Request DTO replacing the proposal list of an event.
 */
public class ProposeActivitiesRequest {

    @NotNull(message = "Activity IDs are required")
    private List<String> activityIds;

    public ProposeActivitiesRequest() {}

    public ProposeActivitiesRequest(List<String> activityIds) {
        this.activityIds = activityIds;
    }

    public List<String> getActivityIds() {
        return activityIds;
    }

    public void setActivityIds(List<String> activityIds) {
        this.activityIds = activityIds;
    }
}
