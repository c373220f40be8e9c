package com.teamouting.planner.model;

import com.teamouting.planner.util.InstantAsLongAttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;

import java.time.Instant;

/**
 * One participant's live vote on one proposed activity.
 * Stored nested in the Event item; unique per (activityId, userId).
 */
@DynamoDbBean
public class ActivityVote {

    private String activityId;
    private String userId;
    private VoteType vote;
    private Instant votedAt;

    // Default constructor for DynamoDB
    public ActivityVote() {
    }

    public ActivityVote(String activityId, String userId, VoteType vote, Instant votedAt) {
        this.activityId = activityId;
        this.userId = userId;
        this.vote = vote;
        this.votedAt = votedAt;
    }

    public boolean matches(String activityId, String userId) {
        return this.activityId.equals(activityId) && this.userId.equals(userId);
    }

    public String getActivityId() {
        return activityId;
    }

    public void setActivityId(String activityId) {
        this.activityId = activityId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public VoteType getVote() {
        return vote;
    }

    public void setVote(VoteType vote) {
        this.vote = vote;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getVotedAt() {
        return votedAt;
    }

    public void setVotedAt(Instant votedAt) {
        this.votedAt = votedAt;
    }
}
