package com.teamouting.planner.dto;

import com.teamouting.planner.model.VoteType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for voting on a proposed activity.
 */
public class ActivityVoteRequest {

    @NotBlank(message = "Activity ID is required")
    private String activityId;

    @NotNull(message = "Vote must be FOR, AGAINST or ABSTAIN")
    private VoteType vote;

    public ActivityVoteRequest() {}

    public ActivityVoteRequest(String activityId, VoteType vote) {
        this.activityId = activityId;
        this.vote = vote;
    }

    public String getActivityId() {
        return activityId;
    }

    public void setActivityId(String activityId) {
        this.activityId = activityId;
    }

    public VoteType getVote() {
        return vote;
    }

    public void setVote(VoteType vote) {
        this.vote = vote;
    }
}
