package com.teamouting.planner.model;

import com.teamouting.planner.util.InstantAsLongAttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One participant's stance on one date option. At most one per (dateOption, userId).
 */
@DynamoDbBean
public class DateResponse {

    private String userId;
    private DateResponseType response;
    private boolean priority;           // Participant's preferred slot
    private BigDecimal contribution;    // Informational pledge
    private String note;
    private Instant respondedAt;

    // Default constructor for DynamoDB
    public DateResponse() {
    }

    public DateResponse(String userId, DateResponseType response, boolean priority,
                        BigDecimal contribution, String note, Instant respondedAt) {
        this.userId = userId;
        this.response = response;
        this.priority = priority;
        this.contribution = contribution;
        this.note = note;
        this.respondedAt = respondedAt;
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

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
    public Instant getRespondedAt() {
        return respondedAt;
    }

    public void setRespondedAt(Instant respondedAt) {
        this.respondedAt = respondedAt;
    }
}
