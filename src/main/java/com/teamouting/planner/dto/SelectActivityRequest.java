package com.teamouting.planner.dto;

import jakarta.validation.constraints.NotBlank;

public class SelectActivityRequest {

    @NotBlank(message = "Activity ID is required")
    private String activityId;

    public SelectActivityRequest() {}

    public SelectActivityRequest(String activityId) {
        this.activityId = activityId;
    }

    public String getActivityId() {
        return activityId;
    }

    public void setActivityId(String activityId) {
        this.activityId = activityId;
    }
}
