package com.teamouting.planner.service.impl;

import com.teamouting.planner.dto.AddDateOptionsRequest;
import com.teamouting.planner.dto.CreateEventRequest;
import com.teamouting.planner.dto.DateOptionDTO;
import com.teamouting.planner.dto.DateResponseRequest;
import com.teamouting.planner.dto.EventDetailDTO;
import com.teamouting.planner.event.EventPhaseChangedEvent;
import com.teamouting.planner.exception.EventBusyException;
import com.teamouting.planner.exception.EventNotFoundException;
import com.teamouting.planner.exception.ResourceNotFoundException;
import com.teamouting.planner.exception.UnauthorizedException;
import com.teamouting.planner.exception.ValidationException;
import com.teamouting.planner.exception.VersionConflictException;
import com.teamouting.planner.model.DateOption;
import com.teamouting.planner.model.DateOptionSort;
import com.teamouting.planner.model.Event;
import com.teamouting.planner.model.EventParticipant;
import com.teamouting.planner.model.EventPhase;
import com.teamouting.planner.model.PhaseChange;
import com.teamouting.planner.model.VoteType;
import com.teamouting.planner.repository.EventRepository;
import com.teamouting.planner.service.EventLifecycleService;
import com.teamouting.planner.util.EventDetailTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

@Service
public class EventLifecycleServiceImpl implements EventLifecycleService {

    private static final Logger logger = LoggerFactory.getLogger(EventLifecycleServiceImpl.class);
    static final int MAX_RETRIES = 5;

    private final EventRepository eventRepository;
    private final ResponseStore responseStore;
    private final ScoringEngine scoringEngine;
    private final PhaseStateMachine phaseStateMachine;
    private final EventLockManager lockManager;
    private final ApplicationEventPublisher eventPublisher;
    private final EventDetailTransformer transformer;
    private final Clock clock;

    /**
     * A change applied to a freshly loaded event under its write lock.
     * Returns the phase change it performed, if any.
     */
    @FunctionalInterface
    private interface EventMutation {
        Optional<PhaseChange> apply(Event event, Instant now);
    }

    @Autowired
    public EventLifecycleServiceImpl(EventRepository eventRepository,
                                     ResponseStore responseStore,
                                     ScoringEngine scoringEngine,
                                     PhaseStateMachine phaseStateMachine,
                                     EventLockManager lockManager,
                                     ApplicationEventPublisher eventPublisher,
                                     EventDetailTransformer transformer,
                                     Clock clock) {
        this.eventRepository = eventRepository;
        this.responseStore = responseStore;
        this.scoringEngine = scoringEngine;
        this.phaseStateMachine = phaseStateMachine;
        this.lockManager = lockManager;
        this.eventPublisher = eventPublisher;
        this.transformer = transformer;
        this.clock = clock;
    }

    @Override
    public EventDetailDTO createEvent(CreateEventRequest request, String organizerUserId) {
        Instant now = clock.instant();
        if (request.getVotingDeadline() != null && !request.getVotingDeadline().isAfter(now)) {
            throw new ValidationException("Voting deadline must be in the future");
        }

        Event event = new Event(request.getRoomId(), request.getName(), request.getDescription(),
                request.getVotingDeadline(), organizerUserId);
        event.setProposedActivityIds(distinctActivityIds(request.getProposedActivityIds()));
        event.getParticipants().add(new EventParticipant(organizerUserId, true, now));

        Event saved = eventRepository.save(event);
        logger.info("User {} created event {} in room {} with {} proposed activities",
                organizerUserId, saved.getEventId(), saved.getRoomId(), saved.getProposedActivityIds().size());
        return transformer.toDetail(saved, organizerUserId);
    }

    @Override
    public EventDetailDTO getEvent(String eventId, String userId) {
        logger.debug("User {} reading event {}", userId, eventId);
        Event event = loadForRead(eventId, userId);
        return transformer.toDetail(event, userId);
    }

    @Override
    public List<DateOptionDTO> getRankedDateOptions(String eventId, DateOptionSort sort, String userId) {
        DateOptionSort effectiveSort = sort != null ? sort : DateOptionSort.SCORE;
        logger.debug("User {} ranking date options of event {} by {}", userId, eventId, effectiveSort);
        Event event = loadForRead(eventId, userId);
        List<DateOption> ranked = scoringEngine.rank(event.getDateOptions(), effectiveSort);
        return transformer.toDateOptionDTOs(ranked, event.getFinalDateOptionId());
    }

    @Override
    public EventDetailDTO addParticipant(String eventId, String userId, boolean organizer) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("User ID is required");
        }
        Event saved = executeWrite(eventId, "addParticipant", (event, now) -> {
            Optional<EventParticipant> existing = event.findParticipant(userId);
            if (existing.isPresent()) {
                existing.get().setOrganizer(organizer);
            } else {
                event.getParticipants().add(new EventParticipant(userId, organizer, now));
            }
            return Optional.empty();
        });
        logger.info("Registered user {} on event {} (organizer={})", userId, eventId, organizer);
        return transformer.toDetail(saved, userId);
    }

    @Override
    public EventDetailDTO proposeActivities(String eventId, List<String> activityIds, String userId) {
        Event saved = executeWrite(eventId, "proposeActivities", (event, now) -> {
            requireParticipant(event, userId);
            phaseStateMachine.requirePhase(event, EventPhase.PROPOSAL);
            List<String> proposals = distinctActivityIds(activityIds);
            event.setProposedActivityIds(proposals);
            event.getExcludedActivityIds().retainAll(proposals);
            return Optional.empty();
        });
        logger.info("User {} proposed {} activities for event {}", userId, saved.getProposedActivityIds().size(), eventId);
        return transformer.toDetail(saved, userId);
    }

    @Override
    public EventDetailDTO removeProposedActivity(String eventId, String activityId, String userId) {
        Event saved = executeWrite(eventId, "removeProposedActivity", (event, now) -> {
            requireOrganizer(event, userId);
            phaseStateMachine.requirePhase(event, EventPhase.PROPOSAL);
            event.getProposedActivityIds().remove(activityId);
            event.getExcludedActivityIds().remove(activityId);
            return Optional.empty();
        });
        logger.info("Organizer {} removed activity {} from event {}", userId, activityId, eventId);
        return transformer.toDetail(saved, userId);
    }

    @Override
    public EventDetailDTO excludeActivity(String eventId, String activityId, String userId) {
        Event saved = executeWrite(eventId, "excludeActivity", (event, now) -> {
            requireOrganizer(event, userId);
            phaseStateMachine.requirePhase(event, EventPhase.PROPOSAL, EventPhase.VOTING);
            requireProposed(event, activityId);
            if (event.getExcludedActivityIds().contains(activityId)) {
                return Optional.empty();
            }
            List<String> remaining = event.candidateActivityIds();
            remaining.remove(activityId);
            if (event.getPhase() == EventPhase.VOTING && remaining.isEmpty()) {
                throw new ValidationException("Cannot exclude the last activity still open for voting");
            }
            event.getExcludedActivityIds().add(activityId);
            return Optional.empty();
        });
        logger.info("Organizer {} excluded activity {} on event {}", userId, activityId, eventId);
        return transformer.toDetail(saved, userId);
    }

    @Override
    public EventDetailDTO includeActivity(String eventId, String activityId, String userId) {
        Event saved = executeWrite(eventId, "includeActivity", (event, now) -> {
            requireOrganizer(event, userId);
            phaseStateMachine.requirePhase(event, EventPhase.PROPOSAL, EventPhase.VOTING);
            requireProposed(event, activityId);
            event.getExcludedActivityIds().remove(activityId);
            return Optional.empty();
        });
        logger.info("Organizer {} re-included activity {} on event {}", userId, activityId, eventId);
        return transformer.toDetail(saved, userId);
    }

    @Override
    public EventDetailDTO openVoting(String eventId, String userId) {
        Event saved = executeWrite(eventId, "openVoting", (event, now) -> {
            requireOrganizer(event, userId);
            phaseStateMachine.requirePhase(event, EventPhase.PROPOSAL);
            if (event.candidateActivityIds().isEmpty()) {
                throw new ValidationException("At least one activity must be proposed before voting opens");
            }
            return Optional.of(phaseStateMachine.advance(event, PhaseStateMachine.Trigger.OPEN_VOTING, null));
        });
        return transformer.toDetail(saved, userId);
    }

    @Override
    public EventDetailDTO castActivityVote(String eventId, String activityId, String userId, VoteType vote) {
        Event saved = executeWrite(eventId, "castActivityVote", (event, now) -> {
            requireParticipant(event, userId);
            responseStore.upsertActivityVote(event, activityId, userId, vote, now);
            return Optional.empty();
        });
        logger.info("User {} voted {} on activity {} of event {}", userId, vote, activityId, eventId);
        return transformer.toDetail(saved, userId);
    }

    @Override
    public EventDetailDTO addDateOptions(String eventId, AddDateOptionsRequest request, String userId) {
        Event saved = executeWrite(eventId, "addDateOptions", (event, now) -> {
            requireParticipant(event, userId);
            responseStore.addDateOptions(event, request.getOptions(), userId, now);
            return Optional.empty();
        });
        logger.info("User {} added {} date options to event {}", userId, request.getOptions().size(), eventId);
        return transformer.toDetail(saved, userId);
    }

    @Override
    public EventDetailDTO respondToDateOption(String eventId, String dateOptionId, String userId, DateResponseRequest request) {
        Event saved = executeWrite(eventId, "respondToDateOption", (event, now) -> {
            requireParticipant(event, userId);
            responseStore.upsertDateResponse(event, dateOptionId, userId, request.getResponse(),
                    request.isPriority(), request.getContribution(), request.getNote(), now);
            return Optional.empty();
        });
        logger.info("User {} responded {} to date option {} of event {}", userId, request.getResponse(), dateOptionId, eventId);
        return transformer.toDetail(saved, userId);
    }

    @Override
    public EventDetailDTO selectWinningActivity(String eventId, String activityId, String userId) {
        Event saved = executeWrite(eventId, "selectWinningActivity", (event, now) -> {
            requireOrganizer(event, userId);
            return Optional.of(phaseStateMachine.advance(event, PhaseStateMachine.Trigger.SELECT_ACTIVITY, activityId));
        });
        return transformer.toDetail(saved, userId);
    }

    @Override
    public EventDetailDTO finalizeDateOption(String eventId, String dateOptionId, String userId) {
        Event saved = executeWrite(eventId, "finalizeDateOption", (event, now) -> {
            requireOrganizer(event, userId);
            return Optional.of(phaseStateMachine.advance(event, PhaseStateMachine.Trigger.FINALIZE_DATE, dateOptionId));
        });
        return transformer.toDetail(saved, userId);
    }

    /**
     * Reads without the write lock unless the voting deadline makes a transition due, in which
     * case the transition is applied and saved through the write path first.
     */
    private Event loadForRead(String eventId, String userId) {
        Event event = loadEvent(eventId);
        requireParticipant(event, userId);
        if (phaseStateMachine.isDeadlineTransitionDue(event, clock.instant())) {
            return executeWrite(eventId, "deadlineCheck", (fresh, now) -> Optional.empty());
        }
        return event;
    }

    /**
     * Shared write path: per-event lock, fresh load, lazy deadline check, mutation, conditional save.
     * A version conflict means another instance wrote the event in between; the whole sequence is
     * re-run against a fresh copy. A mutation that throws leaves the stored event unchanged.
     */
    private Event executeWrite(String eventId, String operation, EventMutation mutation) {
        return lockManager.withEventLock(eventId, () -> {
            for (int attempt = 1; attempt <= MAX_RETRIES; attempt++) {
                try {
                    Event event = loadEvent(eventId);
                    Instant now = clock.instant();

                    List<PhaseChange> deadlineChanges = phaseStateMachine.applyDeadline(event, now);
                    if (!deadlineChanges.isEmpty()) {
                        // Saved on its own so the transition survives a rejected request
                        event = eventRepository.save(event);
                        publishPhaseChanges(event, deadlineChanges);
                    }

                    Optional<PhaseChange> change = mutation.apply(event, now);
                    Event saved = eventRepository.save(event);
                    change.ifPresent(phaseChange -> publishPhaseChanges(saved, List.of(phaseChange)));
                    return saved;
                } catch (VersionConflictException e) {
                    if (attempt < MAX_RETRIES) {
                        logger.warn("Version conflict on {} for event {}, retrying (attempt {}/{})",
                                operation, eventId, attempt, MAX_RETRIES);
                        continue;
                    }
                    logger.warn("Max retries exceeded for {} on event {} after {} attempts", operation, eventId, MAX_RETRIES);
                    throw new EventBusyException("Event " + eventId + " is being modified concurrently, please retry", e);
                }
            }
            throw new EventBusyException("Event " + eventId + " is being modified concurrently, please retry");
        });
    }

    private Event loadEvent(String eventId) {
        return eventRepository.findById(eventId)
                .orElseThrow(() -> new EventNotFoundException("Event not found: " + eventId));
    }

    private void publishPhaseChanges(Event event, List<PhaseChange> changes) {
        for (PhaseChange change : changes) {
            try {
                eventPublisher.publishEvent(new EventPhaseChangedEvent(
                        event.getEventId(),
                        event.getRoomId(),
                        change.from(),
                        change.to(),
                        event.getChosenActivityId(),
                        event.getFinalDateOptionId(),
                        change.automatic()));
            } catch (RuntimeException e) {
                logger.error("Failed to publish phase change {} -> {} for event {}: {}",
                        change.from(), change.to(), event.getEventId(), e.getMessage(), e);
            }
        }
    }

    private EventParticipant requireParticipant(Event event, String userId) {
        return event.findParticipant(userId).orElseThrow(() -> {
            logger.warn("User {} is not a participant of event {}", userId, event.getEventId());
            return new UnauthorizedException("User is not a participant of this event");
        });
    }

    private void requireOrganizer(Event event, String userId) {
        EventParticipant participant = requireParticipant(event, userId);
        if (!participant.isOrganizer()) {
            logger.warn("Non-organizer {} attempted an organizer action on event {}", userId, event.getEventId());
            throw new UnauthorizedException("Only an organizer can perform this action");
        }
    }

    private void requireProposed(Event event, String activityId) {
        if (activityId == null || !event.getProposedActivityIds().contains(activityId)) {
            throw new ResourceNotFoundException("Activity not proposed for event: " + activityId);
        }
    }

    private static List<String> distinctActivityIds(List<String> activityIds) {
        if (activityIds == null) {
            return new ArrayList<>();
        }
        LinkedHashSet<String> distinct = new LinkedHashSet<>();
        for (String activityId : activityIds) {
            if (activityId == null || activityId.isBlank()) {
                throw new ValidationException("Activity IDs cannot be blank");
            }
            distinct.add(activityId.trim());
        }
        return new ArrayList<>(distinct);
    }
}
