package com.teamouting.planner.dto;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * DTO for a candidate date with its consensus score and responses.
 */
public class DateOptionDTO {
    private String dateOptionId;
    private LocalDate date;
    @JsonFormat(pattern = "HH:mm")
    private LocalTime startTime;
    @JsonFormat(pattern = "HH:mm")
    private LocalTime endTime;
    private int score;
    private boolean finalDate;
    private List<DateResponseDTO> responses;

    public DateOptionDTO() {}

    public DateOptionDTO(String dateOptionId, LocalDate date, LocalTime startTime, LocalTime endTime,
                         int score, boolean finalDate, List<DateResponseDTO> responses) {
        this.dateOptionId = dateOptionId;
        this.date = date;
        this.startTime = startTime;
        this.endTime = endTime;
        this.score = score;
        this.finalDate = finalDate;
        this.responses = responses;
    }

    public String getDateOptionId() {
        return dateOptionId;
    }

    public void setDateOptionId(String dateOptionId) {
        this.dateOptionId = dateOptionId;
    }

    public LocalDate getDate() {
        return date;
    }

    public void setDate(LocalDate date) {
        this.date = date;
    }

    public LocalTime getStartTime() {
        return startTime;
    }

    public void setStartTime(LocalTime startTime) {
        this.startTime = startTime;
    }

    public LocalTime getEndTime() {
        return endTime;
    }

    public void setEndTime(LocalTime endTime) {
        this.endTime = endTime;
    }

    public int getScore() {
        return score;
    }

    public void setScore(int score) {
        this.score = score;
    }

    public boolean isFinalDate() {
        return finalDate;
    }

    public void setFinalDate(boolean finalDate) {
        this.finalDate = finalDate;
    }

    public List<DateResponseDTO> getResponses() {
        return responses;
    }

    public void setResponses(List<DateResponseDTO> responses) {
        this.responses = responses;
    }
}
