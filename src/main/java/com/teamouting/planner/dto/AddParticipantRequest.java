package com.teamouting.planner.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO sent by the room membership service when a member joins an event.
 * The organizer flag is resolved by that service and trusted as is.
 */
public class AddParticipantRequest {

    @NotBlank(message = "User ID is required")
    private String userId;

    private boolean organizer = false;

    public AddParticipantRequest() {}

    public AddParticipantRequest(String userId, boolean organizer) {
        this.userId = userId;
        this.organizer = organizer;
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
}
