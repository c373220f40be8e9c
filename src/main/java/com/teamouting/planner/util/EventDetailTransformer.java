package com.teamouting.planner.util;

import com.teamouting.planner.dto.ActivityTallyDTO;
import com.teamouting.planner.dto.DateOptionDTO;
import com.teamouting.planner.dto.DateResponseDTO;
import com.teamouting.planner.dto.EventDetailDTO;
import com.teamouting.planner.dto.ParticipantDTO;
import com.teamouting.planner.model.ActivityTally;
import com.teamouting.planner.model.ActivityVote;
import com.teamouting.planner.model.DateOption;
import com.teamouting.planner.model.Event;
import com.teamouting.planner.model.VoteType;
import com.teamouting.planner.service.impl.ScoringEngine;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the client snapshot of an event. Tallies and scores are computed here at read time;
 * nothing derived is stored on the item.
 */
@Component
public class EventDetailTransformer {

    private final ScoringEngine scoringEngine;

    @Autowired
    public EventDetailTransformer(ScoringEngine scoringEngine) {
        this.scoringEngine = scoringEngine;
    }

    /**
     * @param requestingUserId user whose own activity votes are echoed back in the tallies
     */
    public EventDetailDTO toDetail(Event event, String requestingUserId) {
        EventDetailDTO detail = new EventDetailDTO();
        detail.setEventId(event.getEventId());
        detail.setRoomId(event.getRoomId());
        detail.setName(event.getName());
        detail.setDescription(event.getDescription());
        detail.setCreatedByUserId(event.getCreatedByUserId());
        detail.setPhase(event.getPhase());
        detail.setVotingDeadline(event.getVotingDeadline());
        detail.setProposedActivityIds(List.copyOf(event.getProposedActivityIds()));
        detail.setExcludedActivityIds(List.copyOf(event.getExcludedActivityIds()));
        detail.setChosenActivityId(event.getChosenActivityId());
        detail.setFinalDateOptionId(event.getFinalDateOptionId());
        detail.setVersion(event.getVersion());
        detail.setUpdatedAt(event.getUpdatedAt());

        List<ActivityTally> tallies = scoringEngine.tallies(event.getProposedActivityIds(), event.getActivityVotes());
        detail.setActivities(tallies.stream()
                .map(tally -> new ActivityTallyDTO(tally,
                        event.getExcludedActivityIds().contains(tally.activityId()),
                        userVote(event, tally.activityId(), requestingUserId)))
                .collect(Collectors.toList()));

        detail.setDateOptions(event.getDateOptions().stream()
                .map(option -> toDateOptionDTO(option, event.getFinalDateOptionId()))
                .collect(Collectors.toList()));

        // Only meaningful while responses are still being collected
        if (event.getFinalDateOptionId() == null) {
            scoringEngine.suggestWinningDate(event.getDateOptions())
                    .ifPresent(option -> detail.setSuggestedDateOptionId(option.getDateOptionId()));
        }

        detail.setParticipants(event.getParticipants().stream()
                .map(ParticipantDTO::new)
                .collect(Collectors.toList()));
        return detail;
    }

    public List<DateOptionDTO> toDateOptionDTOs(List<DateOption> options, String finalDateOptionId) {
        return options.stream()
                .map(option -> toDateOptionDTO(option, finalDateOptionId))
                .collect(Collectors.toList());
    }

    public DateOptionDTO toDateOptionDTO(DateOption option, String finalDateOptionId) {
        List<DateResponseDTO> responses = option.getResponses().stream()
                .map(DateResponseDTO::new)
                .collect(Collectors.toList());
        return new DateOptionDTO(
                option.getDateOptionId(),
                option.getDate(),
                option.getStartTime(),
                option.getEndTime(),
                scoringEngine.dateScore(option),
                option.getDateOptionId().equals(finalDateOptionId),
                responses);
    }

    private VoteType userVote(Event event, String activityId, String userId) {
        if (userId == null) {
            return null;
        }
        return event.getActivityVotes().stream()
                .filter(vote -> vote.matches(activityId, userId))
                .map(ActivityVote::getVote)
                .findFirst()
                .orElse(null);
    }
}
