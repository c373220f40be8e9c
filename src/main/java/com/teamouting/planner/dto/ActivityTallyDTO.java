package com.teamouting.planner.dto;

import com.teamouting.planner.model.ActivityTally;
import com.teamouting.planner.model.VoteType;

/**
 * DTO for a proposed activity with its vote counts and the requesting user's own vote.
 */
public class ActivityTallyDTO {
    private String activityId;
    private boolean excluded;
    private int forCount;
    private int againstCount;
    private int abstainCount;
    private int net;
    private VoteType userVote;

    public ActivityTallyDTO() {}

    public ActivityTallyDTO(ActivityTally tally, boolean excluded, VoteType userVote) {
        this.activityId = tally.activityId();
        this.excluded = excluded;
        this.forCount = tally.forCount();
        this.againstCount = tally.againstCount();
        this.abstainCount = tally.abstainCount();
        this.net = tally.net();
        this.userVote = userVote;
    }

    public String getActivityId() {
        return activityId;
    }

    public void setActivityId(String activityId) {
        this.activityId = activityId;
    }

    public boolean isExcluded() {
        return excluded;
    }

    public void setExcluded(boolean excluded) {
        this.excluded = excluded;
    }

    public int getForCount() {
        return forCount;
    }

    public void setForCount(int forCount) {
        this.forCount = forCount;
    }

    public int getAgainstCount() {
        return againstCount;
    }

    public void setAgainstCount(int againstCount) {
        this.againstCount = againstCount;
    }

    public int getAbstainCount() {
        return abstainCount;
    }

    public void setAbstainCount(int abstainCount) {
        this.abstainCount = abstainCount;
    }

    public int getNet() {
        return net;
    }

    public void setNet(int net) {
        this.net = net;
    }

    public VoteType getUserVote() {
        return userVote;
    }

    public void setUserVote(VoteType userVote) {
        this.userVote = userVote;
    }
}
