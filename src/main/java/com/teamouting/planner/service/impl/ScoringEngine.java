package com.teamouting.planner.service.impl;

import com.teamouting.planner.config.EngineProperties;
import com.teamouting.planner.model.ActivityTally;
import com.teamouting.planner.model.ActivityVote;
import com.teamouting.planner.model.DateOption;
import com.teamouting.planner.model.DateOptionSort;
import com.teamouting.planner.model.DateResponse;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Consensus scoring for date options and tallies for activity votes.
 * All methods are side-effect free and deterministic for a given weight configuration.
 */
@Component
public class ScoringEngine {

    private static final Comparator<DateOption> CHRONOLOGICAL = Comparator
        .comparing(DateOption::getDate)
        .thenComparing(DateOption::getStartTime, Comparator.nullsFirst(Comparator.<LocalTime>naturalOrder()));

    private final EngineProperties.Scoring weights;

    @Autowired
    public ScoringEngine(EngineProperties properties) {
        this.weights = properties.getScoring();
    }

    /**
     * Sum of response weights plus the priority bonus for every response flagged as priority.
     */
    public int dateScore(DateOption option) {
        int score = 0;
        for (DateResponse response : option.getResponses()) {
            score += responseWeight(response);
            if (response.isPriority()) {
                score += weights.getPriorityBonus();
            }
        }
        return score;
    }

    private int responseWeight(DateResponse response) {
        return switch (response.getResponse()) {
            case YES -> weights.getYesWeight();
            case MAYBE -> weights.getMaybeWeight();
            case NO -> weights.getNoWeight();
        };
    }

    /**
     * Descending score, ties broken by the earlier date (then earlier start time).
     */
    public Comparator<DateOption> byScore() {
        return Comparator.comparingInt(this::dateScore).reversed().thenComparing(CHRONOLOGICAL);
    }

    public Comparator<DateOption> chronological() {
        return CHRONOLOGICAL;
    }

    /**
     * Returns a sorted copy. The sort is stable, so options that tie completely keep insertion order.
     */
    public List<DateOption> rank(Collection<DateOption> options, DateOptionSort sort) {
        List<DateOption> ranked = new ArrayList<>(options);
        ranked.sort(sort == DateOptionSort.CHRONOLOGICAL ? chronological() : byScore());
        return ranked;
    }

    /**
     * Highest-scoring option; the earliest date wins a tie at the maximum.
     */
    public Optional<DateOption> suggestWinningDate(Collection<DateOption> options) {
        return rank(options, DateOptionSort.SCORE).stream().findFirst();
    }

    public ActivityTally tally(String activityId, Collection<ActivityVote> votes) {
        int forCount = 0;
        int againstCount = 0;
        int abstainCount = 0;
        for (ActivityVote vote : votes) {
            if (!vote.getActivityId().equals(activityId)) {
                continue;
            }
            switch (vote.getVote()) {
                case FOR -> forCount++;
                case AGAINST -> againstCount++;
                case ABSTAIN -> abstainCount++;
            }
        }
        return new ActivityTally(activityId, forCount, againstCount, abstainCount);
    }

    public List<ActivityTally> tallies(List<String> activityIds, Collection<ActivityVote> votes) {
        return activityIds.stream()
            .map(activityId -> tally(activityId, votes))
            .collect(Collectors.toList());
    }

    /**
     * Activity with the highest net (for minus against) tally. Candidates are scanned in proposal
     * order and only a strictly greater net replaces the leader, so the earliest proposal wins ties.
     */
    public Optional<String> pickWinningActivity(List<String> candidateIdsInProposalOrder, Collection<ActivityVote> votes) {
        String winner = null;
        int bestNet = Integer.MIN_VALUE;
        for (String activityId : candidateIdsInProposalOrder) {
            int net = tally(activityId, votes).net();
            if (winner == null || net > bestNet) {
                winner = activityId;
                bestNet = net;
            }
        }
        return Optional.ofNullable(winner);
    }
}
