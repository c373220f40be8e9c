package com.teamouting.planner.dto;

import com.teamouting.planner.model.DateResponse;
import com.teamouting.planner.model.DateResponseType;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * DTO for one participant's response on a date option.
 */
public class DateResponseDTO {
    private String userId;
    private DateResponseType response;
    private boolean priority;
    private BigDecimal contribution;
    private String note;
    private Instant respondedAt;

    public DateResponseDTO() {}

    public DateResponseDTO(DateResponse response) {
        this.userId = response.getUserId();
        this.response = response.getResponse();
        this.priority = response.isPriority();
        this.contribution = response.getContribution();
        this.note = response.getNote();
        this.respondedAt = response.getRespondedAt();
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public DateResponseType getResponse() {
        return response;
    }

    public void setResponse(DateResponseType response) {
        this.response = response;
    }

    public boolean isPriority() {
        return priority;
    }

    public void setPriority(boolean priority) {
        this.priority = priority;
    }

    public BigDecimal getContribution() {
        return contribution;
    }

    public void setContribution(BigDecimal contribution) {
        this.contribution = contribution;
    }

    public String getNote() {
        return note;
    }

    public void setNote(String note) {
        this.note = note;
    }

    public Instant getRespondedAt() {
        return respondedAt;
    }

    public void setRespondedAt(Instant respondedAt) {
        this.respondedAt = respondedAt;
    }
}
