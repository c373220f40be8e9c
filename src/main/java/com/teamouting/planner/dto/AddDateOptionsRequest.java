package com.teamouting.planner.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Request DTO for adding candidate dates in one all-or-nothing batch.
 */
public class AddDateOptionsRequest {

    @NotEmpty(message = "At least one date option is required")
    @Valid
    private List<DateOptionRequest> options;

    public AddDateOptionsRequest() {}

    public AddDateOptionsRequest(List<DateOptionRequest> options) {
        this.options = options;
    }

    public List<DateOptionRequest> getOptions() {
        return options;
    }

    public void setOptions(List<DateOptionRequest> options) {
        this.options = options;
    }
}
