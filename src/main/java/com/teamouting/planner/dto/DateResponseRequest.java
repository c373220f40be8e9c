package com.teamouting.planner.dto;

import com.teamouting.planner.model.DateResponseType;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

/**
 * Request DTO for responding to a candidate date.
 */
public class DateResponseRequest {

    @NotNull(message = "Response must be YES, MAYBE or NO")
    private DateResponseType response;

    private boolean priority = false;

    @PositiveOrZero(message = "Contribution cannot be negative")
    private BigDecimal contribution;

    @Size(max = 500, message = "Note cannot exceed 500 characters")
    private String note;

    public DateResponseRequest() {}

    public DateResponseRequest(DateResponseType response, boolean priority) {
        this.response = response;
        this.priority = priority;
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
}
