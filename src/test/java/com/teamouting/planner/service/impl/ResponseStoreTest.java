package com.teamouting.planner.service.impl;

import com.teamouting.planner.config.EngineProperties;
import com.teamouting.planner.dto.DateOptionRequest;
import com.teamouting.planner.exception.DuplicateDateOptionException;
import com.teamouting.planner.exception.EventFinalizedException;
import com.teamouting.planner.exception.InvalidPhaseTransitionException;
import com.teamouting.planner.exception.LimitExceededException;
import com.teamouting.planner.exception.ResourceNotFoundException;
import com.teamouting.planner.exception.UnauthorizedException;
import com.teamouting.planner.exception.ValidationException;
import com.teamouting.planner.model.ActivityVote;
import com.teamouting.planner.model.DateOption;
import com.teamouting.planner.model.DateResponse;
import com.teamouting.planner.model.DateResponseType;
import com.teamouting.planner.model.Event;
import com.teamouting.planner.model.EventPhase;
import com.teamouting.planner.model.VoteType;
import com.teamouting.planner.testutil.TestEvents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

import static com.teamouting.planner.testutil.TestEvents.MEMBER_A;
import static com.teamouting.planner.testutil.TestEvents.MEMBER_B;
import static com.teamouting.planner.testutil.TestEvents.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseStoreTest {

    private static final LocalDate JUNE_1 = LocalDate.of(2026, 6, 1);

    private ResponseStore responseStore;

    @BeforeEach
    void setUp() {
        EngineProperties properties = new EngineProperties();
        PhaseStateMachine phaseStateMachine = new PhaseStateMachine(new ScoringEngine(properties));
        responseStore = new ResponseStore(phaseStateMachine, properties);
    }

    @Nested
    class ActivityVotes {

        @Test
        void upsertActivityVote_SameVoteTwice_LeavesOneRecord() {
            // Given
            Event event = TestEvents.event(EventPhase.VOTING, "A", "B");

            // When
            responseStore.upsertActivityVote(event, "A", MEMBER_A, VoteType.FOR, NOW);
            responseStore.upsertActivityVote(event, "A", MEMBER_A, VoteType.FOR, NOW.plusSeconds(5));

            // Then
            assertThat(event.getActivityVotes()).hasSize(1);
            ActivityVote vote = event.getActivityVotes().get(0);
            assertThat(vote.getVote()).isEqualTo(VoteType.FOR);
            assertThat(vote.getVotedAt()).isEqualTo(NOW.plusSeconds(5));
        }

        @Test
        void upsertActivityVote_ChangedVote_ReplacesOnlyCallersRecord() {
            Event event = TestEvents.event(EventPhase.VOTING, "A");
            responseStore.upsertActivityVote(event, "A", MEMBER_A, VoteType.FOR, NOW);
            responseStore.upsertActivityVote(event, "A", MEMBER_B, VoteType.FOR, NOW);

            responseStore.upsertActivityVote(event, "A", MEMBER_A, VoteType.AGAINST, NOW);

            assertThat(event.getActivityVotes())
                .extracting(ActivityVote::getUserId, ActivityVote::getVote)
                .containsExactlyInAnyOrder(
                    org.assertj.core.groups.Tuple.tuple(MEMBER_A, VoteType.AGAINST),
                    org.assertj.core.groups.Tuple.tuple(MEMBER_B, VoteType.FOR));
        }

        @Test
        void upsertActivityVote_MarksParticipantAsVoted() {
            Event event = TestEvents.event(EventPhase.VOTING, "A");

            responseStore.upsertActivityVote(event, "A", MEMBER_A, VoteType.ABSTAIN, NOW);

            assertThat(event.findParticipant(MEMBER_A).get().isVoted()).isTrue();
            assertThat(event.findParticipant(MEMBER_B).get().isVoted()).isFalse();
        }

        @Test
        void upsertActivityVote_InScheduling_ThrowsInvalidPhase() {
            Event event = TestEvents.event(EventPhase.SCHEDULING, "A");

            assertThatThrownBy(() -> responseStore.upsertActivityVote(event, "A", MEMBER_A, VoteType.FOR, NOW))
                .isInstanceOf(InvalidPhaseTransitionException.class);
            assertThat(event.getActivityVotes()).isEmpty();
        }

        @Test
        void upsertActivityVote_UnknownActivity_ThrowsNotFound() {
            Event event = TestEvents.event(EventPhase.VOTING, "A");

            assertThatThrownBy(() -> responseStore.upsertActivityVote(event, "Z", MEMBER_A, VoteType.FOR, NOW))
                .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        void upsertActivityVote_ExcludedActivity_ThrowsValidation() {
            Event event = TestEvents.event(EventPhase.VOTING, "A", "B");
            event.getExcludedActivityIds().add("B");

            assertThatThrownBy(() -> responseStore.upsertActivityVote(event, "B", MEMBER_A, VoteType.FOR, NOW))
                .isInstanceOf(ValidationException.class);
        }

        @Test
        void upsertActivityVote_NonParticipant_ThrowsUnauthorized() {
            Event event = TestEvents.event(EventPhase.VOTING, "A");

            assertThatThrownBy(() -> responseStore.upsertActivityVote(event, "A", "stranger", VoteType.FOR, NOW))
                .isInstanceOf(UnauthorizedException.class);
            assertThat(event.getActivityVotes()).isEmpty();
        }
    }

    @Nested
    class DateResponses {

        private Event event;
        private DateOption first;
        private DateOption second;

        @BeforeEach
        void setUp() {
            event = TestEvents.event(EventPhase.SCHEDULING, "A");
            first = TestEvents.addOption(event, JUNE_1, null);
            second = TestEvents.addOption(event, JUNE_1.plusDays(1), null);
        }

        @Test
        void upsertDateResponse_Twice_KeepsOneResponsePerUser() {
            // When
            responseStore.upsertDateResponse(event, first.getDateOptionId(), MEMBER_A, DateResponseType.MAYBE,
                false, null, null, NOW);
            responseStore.upsertDateResponse(event, first.getDateOptionId(), MEMBER_A, DateResponseType.YES,
                false, new BigDecimal("25.00"), "can drive", NOW);

            // Then
            assertThat(first.getResponses()).hasSize(1);
            DateResponse response = first.getResponses().get(0);
            assertThat(response.getResponse()).isEqualTo(DateResponseType.YES);
            assertThat(response.getContribution()).isEqualByComparingTo("25");
            assertThat(response.getNote()).isEqualTo("can drive");
        }

        @Test
        void upsertDateResponse_Priority_ClearsPriorityOnOtherOptions() {
            // Given
            responseStore.upsertDateResponse(event, first.getDateOptionId(), MEMBER_A, DateResponseType.YES,
                true, null, null, NOW);
            responseStore.upsertDateResponse(event, first.getDateOptionId(), MEMBER_B, DateResponseType.YES,
                true, null, null, NOW);

            // When
            responseStore.upsertDateResponse(event, second.getDateOptionId(), MEMBER_A, DateResponseType.YES,
                true, null, null, NOW);

            // Then
            assertThat(first.findResponse(MEMBER_A).get().isPriority()).isFalse();
            assertThat(first.findResponse(MEMBER_B).get().isPriority()).isTrue();
            assertThat(second.findResponse(MEMBER_A).get().isPriority()).isTrue();
        }

        @Test
        void upsertDateResponse_UnknownOption_ThrowsNotFound() {
            assertThatThrownBy(() -> responseStore.upsertDateResponse(event, "missing", MEMBER_A,
                DateResponseType.YES, false, null, null, NOW))
                .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        void upsertDateResponse_NegativeContribution_ThrowsValidation() {
            assertThatThrownBy(() -> responseStore.upsertDateResponse(event, first.getDateOptionId(), MEMBER_A,
                DateResponseType.YES, false, new BigDecimal("-1"), null, NOW))
                .isInstanceOf(ValidationException.class);
            assertThat(first.getResponses()).isEmpty();
        }

        @Test
        void upsertDateResponse_AfterFinalize_ThrowsEventFinalized() {
            event.setPhase(EventPhase.INFO);
            event.setFinalDateOptionId(first.getDateOptionId());

            assertThatThrownBy(() -> responseStore.upsertDateResponse(event, second.getDateOptionId(), MEMBER_A,
                DateResponseType.YES, false, null, null, NOW))
                .isInstanceOf(EventFinalizedException.class);
        }
    }

    @Nested
    class DateOptions {

        @Test
        void addDateOptions_ValidBatch_AppendsAllInOrder() {
            Event event = TestEvents.event(EventPhase.SCHEDULING, "A");

            List<DateOption> created = responseStore.addDateOptions(event, List.of(
                new DateOptionRequest(JUNE_1, LocalTime.of(18, 0), LocalTime.of(21, 0)),
                new DateOptionRequest(JUNE_1.plusDays(1), null, null)), MEMBER_A, NOW);

            assertThat(created).hasSize(2);
            assertThat(event.getDateOptions()).containsExactlyElementsOf(created);
            assertThat(created.get(0).getCreatedByUserId()).isEqualTo(MEMBER_A);
        }

        @Test
        void addDateOption_EleventhOption_ThrowsLimitExceededAndKeepsExistingTen() {
            // Given
            Event event = TestEvents.event(EventPhase.SCHEDULING, "A");
            for (int i = 0; i < 10; i++) {
                TestEvents.addOption(event, JUNE_1.plusDays(i), null);
            }
            List<DateOption> before = new ArrayList<>(event.getDateOptions());

            // When / Then
            assertThatThrownBy(() -> responseStore.addDateOption(event,
                new DateOptionRequest(JUNE_1.plusDays(30), null, null), MEMBER_A, NOW))
                .isInstanceOf(LimitExceededException.class);
            assertThat(event.getDateOptions()).containsExactlyElementsOf(before);
        }

        @Test
        void addDateOption_TenthOption_IsAccepted() {
            Event event = TestEvents.event(EventPhase.SCHEDULING, "A");
            for (int i = 0; i < 9; i++) {
                TestEvents.addOption(event, JUNE_1.plusDays(i), null);
            }

            responseStore.addDateOption(event, new DateOptionRequest(JUNE_1.plusDays(30), null, null), MEMBER_A, NOW);

            assertThat(event.getDateOptions()).hasSize(10);
        }

        @Test
        void addDateOptions_BatchCrossingCap_AddsNothing() {
            // Given
            Event event = TestEvents.event(EventPhase.SCHEDULING, "A");
            for (int i = 0; i < 8; i++) {
                TestEvents.addOption(event, JUNE_1.plusDays(i), null);
            }

            // When / Then
            assertThatThrownBy(() -> responseStore.addDateOptions(event, List.of(
                new DateOptionRequest(JUNE_1.plusDays(20), null, null),
                new DateOptionRequest(JUNE_1.plusDays(21), null, null),
                new DateOptionRequest(JUNE_1.plusDays(22), null, null)), MEMBER_A, NOW))
                .isInstanceOf(LimitExceededException.class);
            assertThat(event.getDateOptions()).hasSize(8);
        }

        @Test
        void addDateOptions_DuplicateOfExistingSlot_ThrowsDuplicate() {
            Event event = TestEvents.event(EventPhase.SCHEDULING, "A");
            TestEvents.addOption(event, JUNE_1, LocalTime.of(18, 0));

            assertThatThrownBy(() -> responseStore.addDateOption(event,
                new DateOptionRequest(JUNE_1, LocalTime.of(18, 0), LocalTime.of(22, 0)), MEMBER_A, NOW))
                .isInstanceOf(DuplicateDateOptionException.class);
        }

        @Test
        void addDateOptions_SameDateDifferentStartTime_IsAccepted() {
            Event event = TestEvents.event(EventPhase.SCHEDULING, "A");
            TestEvents.addOption(event, JUNE_1, LocalTime.of(18, 0));

            responseStore.addDateOption(event, new DateOptionRequest(JUNE_1, LocalTime.of(10, 0), null), MEMBER_A, NOW);

            assertThat(event.getDateOptions()).hasSize(2);
        }

        @Test
        void addDateOptions_DuplicateWithinBatch_AddsNothing() {
            Event event = TestEvents.event(EventPhase.SCHEDULING, "A");

            assertThatThrownBy(() -> responseStore.addDateOptions(event, List.of(
                new DateOptionRequest(JUNE_1, null, null),
                new DateOptionRequest(JUNE_1.plusDays(1), null, null),
                new DateOptionRequest(JUNE_1, null, null)), MEMBER_A, NOW))
                .isInstanceOf(DuplicateDateOptionException.class);
            assertThat(event.getDateOptions()).isEmpty();
        }

        @Test
        void addDateOption_EndTimeWithoutStartTime_ThrowsValidation() {
            Event event = TestEvents.event(EventPhase.SCHEDULING, "A");

            assertThatThrownBy(() -> responseStore.addDateOption(event,
                new DateOptionRequest(JUNE_1, null, LocalTime.of(20, 0)), MEMBER_A, NOW))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("start time");
        }

        @Test
        void addDateOption_EndBeforeStart_ThrowsValidation() {
            Event event = TestEvents.event(EventPhase.SCHEDULING, "A");

            assertThatThrownBy(() -> responseStore.addDateOption(event,
                new DateOptionRequest(JUNE_1, LocalTime.of(20, 0), LocalTime.of(19, 0)), MEMBER_A, NOW))
                .isInstanceOf(ValidationException.class);
        }

        @Test
        void addDateOption_InVoting_ThrowsInvalidPhase() {
            Event event = TestEvents.event(EventPhase.VOTING, "A");

            assertThatThrownBy(() -> responseStore.addDateOption(event,
                new DateOptionRequest(JUNE_1, null, null), MEMBER_A, NOW))
                .isInstanceOf(InvalidPhaseTransitionException.class);
        }

        @Test
        void addDateOption_WithLowerCap_UsesConfiguredCap() {
            EngineProperties properties = new EngineProperties();
            properties.setMaxDateOptions(2);
            ResponseStore capped = new ResponseStore(new PhaseStateMachine(new ScoringEngine(properties)), properties);
            Event event = TestEvents.event(EventPhase.SCHEDULING, "A");
            TestEvents.addOption(event, JUNE_1, null);
            TestEvents.addOption(event, JUNE_1.plusDays(1), null);

            assertThatThrownBy(() -> capped.addDateOption(event,
                new DateOptionRequest(JUNE_1.plusDays(2), null, null), MEMBER_A, NOW))
                .isInstanceOf(LimitExceededException.class);
        }
    }
}
