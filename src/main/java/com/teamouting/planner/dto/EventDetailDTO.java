package com.teamouting.planner.dto;

import com.teamouting.planner.model.EventPhase;

import java.time.Instant;
import java.util.List;

/**
 * Full snapshot of an event as returned by every lifecycle operation.
 * Scores, tallies and the suggested date are computed by the engine, not by clients.
 */
public class EventDetailDTO {
    private String eventId;
    private String roomId;
    private String name;
    private String description;
    private String createdByUserId;
    private EventPhase phase;
    private Instant votingDeadline;
    private List<String> proposedActivityIds;
    private List<String> excludedActivityIds;
    private String chosenActivityId;
    private String finalDateOptionId;
    private String suggestedDateOptionId;
    private List<ActivityTallyDTO> activities;
    private List<DateOptionDTO> dateOptions;
    private List<ParticipantDTO> participants;
    private Long version;
    private Instant updatedAt;

    public EventDetailDTO() {}

    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public String getRoomId() {
        return roomId;
    }

    public void setRoomId(String roomId) {
        this.roomId = roomId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getCreatedByUserId() {
        return createdByUserId;
    }

    public void setCreatedByUserId(String createdByUserId) {
        this.createdByUserId = createdByUserId;
    }

    public EventPhase getPhase() {
        return phase;
    }

    public void setPhase(EventPhase phase) {
        this.phase = phase;
    }

    public Instant getVotingDeadline() {
        return votingDeadline;
    }

    public void setVotingDeadline(Instant votingDeadline) {
        this.votingDeadline = votingDeadline;
    }

    public List<String> getProposedActivityIds() {
        return proposedActivityIds;
    }

    public void setProposedActivityIds(List<String> proposedActivityIds) {
        this.proposedActivityIds = proposedActivityIds;
    }

    public List<String> getExcludedActivityIds() {
        return excludedActivityIds;
    }

    public void setExcludedActivityIds(List<String> excludedActivityIds) {
        this.excludedActivityIds = excludedActivityIds;
    }

    public String getChosenActivityId() {
        return chosenActivityId;
    }

    public void setChosenActivityId(String chosenActivityId) {
        this.chosenActivityId = chosenActivityId;
    }

    public String getFinalDateOptionId() {
        return finalDateOptionId;
    }

    public void setFinalDateOptionId(String finalDateOptionId) {
        this.finalDateOptionId = finalDateOptionId;
    }

    public String getSuggestedDateOptionId() {
        return suggestedDateOptionId;
    }

    public void setSuggestedDateOptionId(String suggestedDateOptionId) {
        this.suggestedDateOptionId = suggestedDateOptionId;
    }

    public List<ActivityTallyDTO> getActivities() {
        return activities;
    }

    public void setActivities(List<ActivityTallyDTO> activities) {
        this.activities = activities;
    }

    public List<DateOptionDTO> getDateOptions() {
        return dateOptions;
    }

    public void setDateOptions(List<DateOptionDTO> dateOptions) {
        this.dateOptions = dateOptions;
    }

    public List<ParticipantDTO> getParticipants() {
        return participants;
    }

    public void setParticipants(List<ParticipantDTO> participants) {
        this.participants = participants;
    }

    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
