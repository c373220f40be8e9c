package com.teamouting.planner.service.impl;

import com.teamouting.planner.exception.EventFinalizedException;
import com.teamouting.planner.exception.InvalidPhaseTransitionException;
import com.teamouting.planner.exception.ResourceNotFoundException;
import com.teamouting.planner.exception.ValidationException;
import com.teamouting.planner.model.Event;
import com.teamouting.planner.model.EventPhase;
import com.teamouting.planner.model.PhaseChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the phase of an event. Every transition goes through {@link #advance} and is checked
 * against a fixed table: PROPOSAL -> VOTING -> SCHEDULING -> INFO, no skips, no way back.
 * Validation happens before any field is written, so a rejected transition leaves the event untouched.
 */
@Component
public class PhaseStateMachine {

    private static final Logger logger = LoggerFactory.getLogger(PhaseStateMachine.class);

    /**
     * What caused a transition. Each trigger is legal from exactly one phase.
     */
    public enum Trigger {
        OPEN_VOTING(EventPhase.PROPOSAL),
        SELECT_ACTIVITY(EventPhase.VOTING),
        FINALIZE_DATE(EventPhase.SCHEDULING),
        DEADLINE_ELAPSED(EventPhase.VOTING);

        private final EventPhase source;

        Trigger(EventPhase source) {
            this.source = source;
        }

        public EventPhase getSource() {
            return source;
        }
    }

    private static final Map<EventPhase, EventPhase> NEXT_PHASE = new EnumMap<>(EventPhase.class);

    static {
        NEXT_PHASE.put(EventPhase.PROPOSAL, EventPhase.VOTING);
        NEXT_PHASE.put(EventPhase.VOTING, EventPhase.SCHEDULING);
        NEXT_PHASE.put(EventPhase.SCHEDULING, EventPhase.INFO);
    }

    private final ScoringEngine scoringEngine;

    @Autowired
    public PhaseStateMachine(ScoringEngine scoringEngine) {
        this.scoringEngine = scoringEngine;
    }

    public boolean canTransition(EventPhase from, EventPhase to) {
        return NEXT_PHASE.get(from) == to;
    }

    /**
     * Rejects the call unless the event is in one of the allowed phases.
     * A finalized event always fails with {@link EventFinalizedException}.
     */
    public void requirePhase(Event event, EventPhase... allowed) {
        if (event.isFinalized()) {
            throw new EventFinalizedException("Event " + event.getEventId() + " is finalized");
        }
        if (!Arrays.asList(allowed).contains(event.getPhase())) {
            throw new InvalidPhaseTransitionException(String.format(
                "Operation not allowed in phase %s (allowed: %s)", event.getPhase(), Arrays.toString(allowed)));
        }
    }

    /**
     * Performs one transition.
     *
     * @param targetId activity id for SELECT_ACTIVITY and DEADLINE_ELAPSED, date option id for FINALIZE_DATE, ignored otherwise
     */
    public PhaseChange advance(Event event, Trigger trigger, String targetId) {
        EventPhase from = event.getPhase();
        if (from.isTerminal()) {
            throw new EventFinalizedException("Event " + event.getEventId() + " is finalized");
        }
        if (from != trigger.getSource()) {
            throw new InvalidPhaseTransitionException(String.format(
                "Cannot %s while event is in phase %s", trigger.name().toLowerCase().replace('_', ' '), from));
        }
        EventPhase to = NEXT_PHASE.get(from);

        switch (trigger) {
            case SELECT_ACTIVITY, DEADLINE_ELAPSED -> {
                requireCandidateActivity(event, targetId);
                event.setChosenActivityId(targetId);
            }
            case FINALIZE_DATE -> {
                if (targetId == null || event.findDateOption(targetId).isEmpty()) {
                    throw new ResourceNotFoundException("Date option not found in event: " + targetId);
                }
                event.setFinalDateOptionId(targetId);
            }
            case OPEN_VOTING -> {
                // no field besides the phase
            }
        }

        event.setPhase(to);
        event.touch();
        boolean automatic = trigger == Trigger.DEADLINE_ELAPSED;
        logger.info("Event {} moved {} -> {} ({})", event.getEventId(), from, to, trigger);
        return automatic ? PhaseChange.deadline(from, to) : PhaseChange.manual(from, to);
    }

    private void requireCandidateActivity(Event event, String activityId) {
        if (activityId == null || !event.getProposedActivityIds().contains(activityId)) {
            throw new ResourceNotFoundException("Activity not proposed for event: " + activityId);
        }
        if (event.getExcludedActivityIds().contains(activityId)) {
            throw new ValidationException("Activity has been excluded from the vote: " + activityId);
        }
    }

    public boolean isDeadlineTransitionDue(Event event, Instant now) {
        return event.getVotingDeadline() != null
            && !now.isBefore(event.getVotingDeadline())
            && (event.getPhase() == EventPhase.PROPOSAL || event.getPhase() == EventPhase.VOTING)
            && !event.candidateActivityIds().isEmpty();
    }

    /**
     * Lazy deadline check run at the start of every entry point. Once the voting deadline has
     * passed, an event still in proposal or voting is walked phase by phase to scheduling, choosing
     * the activity with the best net tally. Does nothing when no candidate activity exists.
     *
     * @return the transitions performed, empty if none was due
     */
    public List<PhaseChange> applyDeadline(Event event, Instant now) {
        if (!isDeadlineTransitionDue(event, now)) {
            return Collections.emptyList();
        }
        List<PhaseChange> changes = new ArrayList<>();
        if (event.getPhase() == EventPhase.PROPOSAL) {
            event.setPhase(EventPhase.VOTING);
            event.touch();
            changes.add(PhaseChange.deadline(EventPhase.PROPOSAL, EventPhase.VOTING));
            logger.info("Event {} moved PROPOSAL -> VOTING (voting deadline {} elapsed)",
                event.getEventId(), event.getVotingDeadline());
        }
        Optional<String> winner = scoringEngine.pickWinningActivity(event.candidateActivityIds(), event.getActivityVotes());
        winner.ifPresent(activityId -> changes.add(advance(event, Trigger.DEADLINE_ELAPSED, activityId)));
        return changes;
    }
}
