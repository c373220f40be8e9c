package com.teamouting.planner.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Request DTO for creating a new outing event in a room.
 */
public class CreateEventRequest {

    @NotBlank(message = "Room ID is required")
    private String roomId;

    @NotBlank(message = "Event name is required")
    @Size(max = 200, message = "Event name cannot exceed 200 characters")
    private String name;

    @Size(max = 2000, message = "Event description cannot exceed 2000 characters")
    private String description;

    private Instant votingDeadline;

    private List<@NotBlank String> proposedActivityIds = new ArrayList<>();

    public CreateEventRequest() {}

    public CreateEventRequest(String roomId, String name, String description, Instant votingDeadline,
                              List<String> proposedActivityIds) {
        this.roomId = roomId;
        this.name = name;
        this.description = description;
        this.votingDeadline = votingDeadline;
        this.proposedActivityIds = proposedActivityIds;
    }

    public String getRoomId() {
        return roomId;
    }

    public void setRoomId(String roomId) {
        this.roomId = roomId;
    }

    public String getName() {
        return name != null ? name.trim() : null;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description != null ? description.trim() : null;
    }

    public void setDescription(String description) {
        this.description = description;
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
}
