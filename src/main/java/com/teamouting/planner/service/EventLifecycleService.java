package com.teamouting.planner.service;

import com.teamouting.planner.dto.AddDateOptionsRequest;
import com.teamouting.planner.dto.CreateEventRequest;
import com.teamouting.planner.dto.DateOptionDTO;
import com.teamouting.planner.dto.DateResponseRequest;
import com.teamouting.planner.dto.EventDetailDTO;
import com.teamouting.planner.model.DateOptionSort;
import com.teamouting.planner.model.VoteType;

import java.util.List;

/**
 * Orchestrates an outing event from activity proposal to a finalized date.
 * Every call first applies any transition that an elapsed voting deadline makes due, and every
 * successful mutation returns the full event snapshot.
 */
public interface EventLifecycleService {

    EventDetailDTO createEvent(CreateEventRequest request, String organizerUserId);

    EventDetailDTO getEvent(String eventId, String userId);

    /**
     * Registers a room member on the event. The organizer flag comes from the membership
     * service and is trusted as given.
     */
    EventDetailDTO addParticipant(String eventId, String userId, boolean organizer);

    /**
     * Replaces the proposal list. Proposal phase only.
     */
    EventDetailDTO proposeActivities(String eventId, List<String> activityIds, String userId);

    EventDetailDTO removeProposedActivity(String eventId, String activityId, String userId);

    EventDetailDTO excludeActivity(String eventId, String activityId, String userId);

    EventDetailDTO includeActivity(String eventId, String activityId, String userId);

    EventDetailDTO openVoting(String eventId, String userId);

    EventDetailDTO castActivityVote(String eventId, String activityId, String userId, VoteType vote);

    /**
     * Adds a batch of date options; all of them are accepted or none is.
     */
    EventDetailDTO addDateOptions(String eventId, AddDateOptionsRequest request, String userId);

    EventDetailDTO respondToDateOption(String eventId, String dateOptionId, String userId, DateResponseRequest request);

    List<DateOptionDTO> getRankedDateOptions(String eventId, DateOptionSort sort, String userId);

    EventDetailDTO selectWinningActivity(String eventId, String activityId, String userId);

    EventDetailDTO finalizeDateOption(String eventId, String dateOptionId, String userId);
}
