package com.teamouting.planner.dto;

import jakarta.validation.constraints.NotBlank;

public class FinalizeDateRequest {

    @NotBlank(message = "Date option ID is required")
    private String dateOptionId;

    public FinalizeDateRequest() {}

    public FinalizeDateRequest(String dateOptionId) {
        this.dateOptionId = dateOptionId;
    }

    public String getDateOptionId() {
        return dateOptionId;
    }

    public void setDateOptionId(String dateOptionId) {
        this.dateOptionId = dateOptionId;
    }
}
