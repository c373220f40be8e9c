package com.teamouting.planner.model;

import com.teamouting.planner.util.InstantAsLongAttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Candidate date (and optional time window) for an event.
 * Created during scheduling only and never removed; its responses may change.
 */
@DynamoDbBean
public class DateOption {

    private String dateOptionId;
    private LocalDate date;
    private LocalTime startTime;
    private LocalTime endTime;
    private String createdByUserId;
    private Instant createdAt;
    private List<DateResponse> responses = new ArrayList<>();

    // Default constructor for DynamoDB
    public DateOption() {
    }

    public DateOption(LocalDate date, LocalTime startTime, LocalTime endTime, String createdByUserId, Instant createdAt) {
        this.dateOptionId = UUID.randomUUID().toString();
        this.date = date;
        this.startTime = startTime;
        this.endTime = endTime;
        this.createdByUserId = createdByUserId;
        this.createdAt = createdAt;
    }

    public Optional<DateResponse> findResponse(String userId) {
        return responses.stream()
            .filter(response -> response.getUserId().equals(userId))
            .findFirst();
    }

    /**
     * Two options collide when they share the calendar date and the start time (both absent counts as equal).
     */
    public boolean sameSlotAs(LocalDate otherDate, LocalTime otherStartTime) {
        return date.equals(otherDate) && Objects.equals(startTime, otherStartTime);
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

    public String getCreatedByUserId() {
        return createdByUserId;
    }

    public void setCreatedByUserId(String createdByUserId) {
        this.createdByUserId = createdByUserId;
    }

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public List<DateResponse> getResponses() {
        return responses;
    }

    public void setResponses(List<DateResponse> responses) {
        this.responses = responses != null ? new ArrayList<>(responses) : new ArrayList<>();
    }
}
