package com.teamouting.planner.model;

import com.teamouting.planner.util.InstantAsLongAttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;

import java.time.Instant;

/**
 * Membership record of a user in an event. Kept for the whole lifetime of the event.
 */
@DynamoDbBean
public class EventParticipant {

    private String userId;
    private boolean organizer;
    private boolean voted;      // Set once the user casts any activity vote
    private Instant joinedAt;

    // Default constructor for DynamoDB
    public EventParticipant() {
    }

    public EventParticipant(String userId, boolean organizer, Instant joinedAt) {
        this.userId = userId;
        this.organizer = organizer;
        this.joinedAt = joinedAt;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public boolean isOrganizer() {
        return organizer;
    }

    public void setOrganizer(boolean organizer) {
        this.organizer = organizer;
    }

    public boolean isVoted() {
        return voted;
    }

    public void setVoted(boolean voted) {
        this.voted = voted;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getJoinedAt() {
        return joinedAt;
    }

    public void setJoinedAt(Instant joinedAt) {
        this.joinedAt = joinedAt;
    }
}
