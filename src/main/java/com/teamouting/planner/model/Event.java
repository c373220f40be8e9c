package com.teamouting.planner.model;

import com.teamouting.planner.util.InstantAsLongAttributeConverter;
import com.teamouting.planner.util.OutingKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.extensions.annotations.DynamoDbVersionAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbConvertedBy;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Event aggregate for the OutingTable. One item holds the whole aggregate:
 * participants, activity votes, date options and their responses.
 *
 * Key Pattern: PK = EVENT#{eventId}, SK = METADATA
 */
@DynamoDbBean
public class Event extends BaseItem {

    private String eventId;
    private String roomId;
    private String name;
    private String description;
    private String createdByUserId;
    private EventPhase phase;
    private Instant votingDeadline;
    private List<String> proposedActivityIds = new ArrayList<>();   // Proposal order is the tie-break order
    private List<String> excludedActivityIds = new ArrayList<>();
    private String chosenActivityId;
    private String finalDateOptionId;
    private List<ActivityVote> activityVotes = new ArrayList<>();
    private List<DateOption> dateOptions = new ArrayList<>();
    private List<EventParticipant> participants = new ArrayList<>();
    private Long version;                                           // Optimistic locking

    // Default constructor for DynamoDB
    public Event() {
        super();
        setItemType(OutingKeyFactory.EVENT_ITEM_TYPE);
        // version is null for new items - DynamoDB Enhanced Client will set it to 1 on first save
    }

    /**
     * Create a new event in the proposal phase.
     */
    public Event(String roomId, String name, String description, Instant votingDeadline, String createdByUserId) {
        this();
        this.eventId = UUID.randomUUID().toString();
        this.roomId = roomId;
        this.name = name;
        this.description = description;
        this.votingDeadline = votingDeadline;
        this.createdByUserId = createdByUserId;
        this.phase = EventPhase.PROPOSAL;

        setPk(OutingKeyFactory.getEventPk(eventId));
        setSk(OutingKeyFactory.getMetadataSk());
    }

    public Optional<EventParticipant> findParticipant(String userId) {
        return participants.stream()
            .filter(participant -> participant.getUserId().equals(userId))
            .findFirst();
    }

    public Optional<DateOption> findDateOption(String dateOptionId) {
        return dateOptions.stream()
            .filter(option -> option.getDateOptionId().equals(dateOptionId))
            .findFirst();
    }

    /**
     * Proposed activities that have not been excluded, in proposal order.
     */
    public List<String> candidateActivityIds() {
        List<String> candidates = new ArrayList<>(proposedActivityIds);
        candidates.removeAll(excludedActivityIds);
        return candidates;
    }

    @DynamoDbIgnore
    public boolean isFinalized() {
        return phase == EventPhase.INFO;
    }

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

    @DynamoDbConvertedBy(InstantAsLongAttributeConverter.class)
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
        this.proposedActivityIds = proposedActivityIds != null ? new ArrayList<>(proposedActivityIds) : new ArrayList<>();
    }

    public List<String> getExcludedActivityIds() {
        return excludedActivityIds;
    }

    public void setExcludedActivityIds(List<String> excludedActivityIds) {
        this.excludedActivityIds = excludedActivityIds != null ? new ArrayList<>(excludedActivityIds) : new ArrayList<>();
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

    public List<ActivityVote> getActivityVotes() {
        return activityVotes;
    }

    public void setActivityVotes(List<ActivityVote> activityVotes) {
        this.activityVotes = activityVotes != null ? new ArrayList<>(activityVotes) : new ArrayList<>();
    }

    public List<DateOption> getDateOptions() {
        return dateOptions;
    }

    public void setDateOptions(List<DateOption> dateOptions) {
        this.dateOptions = dateOptions != null ? new ArrayList<>(dateOptions) : new ArrayList<>();
    }

    public List<EventParticipant> getParticipants() {
        return participants;
    }

    public void setParticipants(List<EventParticipant> participants) {
        this.participants = participants != null ? new ArrayList<>(participants) : new ArrayList<>();
    }

    @DynamoDbVersionAttribute
    public Long getVersion() {
        return version;
    }

    public void setVersion(Long version) {
        this.version = version;
    }
}
