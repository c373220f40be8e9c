package com.teamouting.planner.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.teamouting.planner.model.EventParticipant;

public class ParticipantDTO {
    private String userId;
    private boolean organizer;
    @JsonProperty("hasVoted")
    private boolean voted;

    public ParticipantDTO() {}

    public ParticipantDTO(EventParticipant participant) {
        this.userId = participant.getUserId();
        this.organizer = participant.isOrganizer();
        this.voted = participant.isVoted();
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

    @JsonProperty("hasVoted")
    public boolean isVoted() {
        return voted;
    }

    public void setVoted(boolean voted) {
        this.voted = voted;
    }
}
