package com.teamouting.planner.service.impl;

import com.teamouting.planner.config.EngineProperties;
import com.teamouting.planner.dto.DateOptionRequest;
import com.teamouting.planner.exception.DuplicateDateOptionException;
import com.teamouting.planner.exception.LimitExceededException;
import com.teamouting.planner.exception.ResourceNotFoundException;
import com.teamouting.planner.exception.UnauthorizedException;
import com.teamouting.planner.exception.ValidationException;
import com.teamouting.planner.model.ActivityVote;
import com.teamouting.planner.model.DateOption;
import com.teamouting.planner.model.DateResponse;
import com.teamouting.planner.model.DateResponseType;
import com.teamouting.planner.model.Event;
import com.teamouting.planner.model.EventParticipant;
import com.teamouting.planner.model.EventPhase;
import com.teamouting.planner.model.VoteType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Upserts of activity votes, date responses and date options on a loaded event aggregate.
 *
 * Records are keyed by (entityId, userId): a new submission replaces the caller's previous one and
 * never touches another user's record. Callers must hold the event's write lock; every check runs
 * before the aggregate is modified.
 */
@Component
public class ResponseStore {

    private static final Logger logger = LoggerFactory.getLogger(ResponseStore.class);

    private final PhaseStateMachine phaseStateMachine;
    private final EngineProperties properties;

    @Autowired
    public ResponseStore(PhaseStateMachine phaseStateMachine, EngineProperties properties) {
        this.phaseStateMachine = phaseStateMachine;
        this.properties = properties;
    }

    public ActivityVote upsertActivityVote(Event event, String activityId, String userId, VoteType vote, Instant now) {
        phaseStateMachine.requirePhase(event, EventPhase.VOTING);
        if (vote == null) {
            throw new ValidationException("Vote is required");
        }
        if (!event.getProposedActivityIds().contains(activityId)) {
            throw new ResourceNotFoundException("Activity not proposed for event: " + activityId);
        }
        if (event.getExcludedActivityIds().contains(activityId)) {
            throw new ValidationException("Activity has been excluded from the vote: " + activityId);
        }
        EventParticipant participant = event.findParticipant(userId)
            .orElseThrow(() -> new UnauthorizedException("User is not a participant of this event"));

        Optional<ActivityVote> existing = event.getActivityVotes().stream()
            .filter(existingVote -> existingVote.matches(activityId, userId))
            .findFirst();

        ActivityVote result;
        if (existing.isPresent()) {
            result = existing.get();
            logger.debug("Replacing vote {} -> {} by user {} on activity {}", result.getVote(), vote, userId, activityId);
            result.setVote(vote);
            result.setVotedAt(now);
        } else {
            result = new ActivityVote(activityId, userId, vote, now);
            event.getActivityVotes().add(result);
        }
        participant.setVoted(true);
        return result;
    }

    /**
     * Replaces the user's response on one date option. Marking a response as priority clears the
     * user's priority flag on every other option of the event.
     */
    public DateResponse upsertDateResponse(Event event, String dateOptionId, String userId, DateResponseType response,
                                           boolean priority, BigDecimal contribution, String note, Instant now) {
        phaseStateMachine.requirePhase(event, EventPhase.SCHEDULING);
        if (response == null) {
            throw new ValidationException("Response is required");
        }
        if (contribution != null && contribution.signum() < 0) {
            throw new ValidationException("Contribution cannot be negative");
        }
        DateOption option = event.findDateOption(dateOptionId)
            .orElseThrow(() -> new ResourceNotFoundException("Date option not found in event: " + dateOptionId));

        if (priority) {
            for (DateOption other : event.getDateOptions()) {
                if (!other.getDateOptionId().equals(dateOptionId)) {
                    other.findResponse(userId).ifPresent(previous -> previous.setPriority(false));
                }
            }
        }

        Optional<DateResponse> existing = option.findResponse(userId);
        DateResponse result;
        if (existing.isPresent()) {
            result = existing.get();
            result.setResponse(response);
            result.setPriority(priority);
            result.setContribution(contribution);
            result.setNote(note);
            result.setRespondedAt(now);
        } else {
            result = new DateResponse(userId, response, priority, contribution, note, now);
            option.getResponses().add(result);
        }
        return result;
    }

    public DateOption addDateOption(Event event, DateOptionRequest request, String userId, Instant now) {
        return addDateOptions(event, List.of(request), userId, now).get(0);
    }

    /**
     * Adds a batch of date options. Either every option is accepted or none is: the whole batch is
     * validated (time windows, duplicates against the event and within the batch, the cap) before
     * the first option is appended.
     */
    public List<DateOption> addDateOptions(Event event, List<DateOptionRequest> requests, String userId, Instant now) {
        phaseStateMachine.requirePhase(event, EventPhase.SCHEDULING);
        if (requests == null || requests.isEmpty()) {
            throw new ValidationException("At least one date option is required");
        }

        List<DateOptionRequest> accepted = new ArrayList<>();
        for (DateOptionRequest request : requests) {
            validateWindow(request);
            boolean clashesWithEvent = event.getDateOptions().stream()
                .anyMatch(option -> option.sameSlotAs(request.getDate(), request.getStartTime()));
            boolean clashesWithBatch = accepted.stream()
                .anyMatch(other -> sameSlot(other, request.getDate(), request.getStartTime()));
            if (clashesWithEvent || clashesWithBatch) {
                throw new DuplicateDateOptionException(String.format("Date option %s %s already proposed",
                    request.getDate(), request.getStartTime() != null ? request.getStartTime() : "(all day)"));
            }
            accepted.add(request);
        }

        int maxDateOptions = properties.getMaxDateOptions();
        int resulting = event.getDateOptions().size() + accepted.size();
        if (resulting > maxDateOptions) {
            throw new LimitExceededException(String.format(
                "Maximum %d date options allowed (event has %d, batch adds %d)",
                maxDateOptions, event.getDateOptions().size(), accepted.size()));
        }

        List<DateOption> created = new ArrayList<>();
        for (DateOptionRequest request : accepted) {
            DateOption option = new DateOption(request.getDate(), request.getStartTime(), request.getEndTime(), userId, now);
            event.getDateOptions().add(option);
            created.add(option);
        }
        return created;
    }

    private void validateWindow(DateOptionRequest request) {
        if (request == null || request.getDate() == null) {
            throw new ValidationException("Date is required");
        }
        if (request.getEndTime() != null && request.getStartTime() == null) {
            throw new ValidationException("End time requires a start time");
        }
        if (request.getEndTime() != null && !request.getEndTime().isAfter(request.getStartTime())) {
            throw new ValidationException("End time must be after start time");
        }
    }

    private static boolean sameSlot(DateOptionRequest request, LocalDate date, LocalTime startTime) {
        return request.getDate().equals(date) && Objects.equals(request.getStartTime(), startTime);
    }
}
