package com.teamouting.planner.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamouting.planner.dto.ActivityVoteRequest;
import com.teamouting.planner.dto.AddDateOptionsRequest;
import com.teamouting.planner.dto.CreateEventRequest;
import com.teamouting.planner.dto.DateOptionDTO;
import com.teamouting.planner.dto.DateResponseRequest;
import com.teamouting.planner.dto.EventDetailDTO;
import com.teamouting.planner.dto.FinalizeDateRequest;
import com.teamouting.planner.dto.SelectActivityRequest;
import com.teamouting.planner.exception.DuplicateDateOptionException;
import com.teamouting.planner.exception.EventBusyException;
import com.teamouting.planner.exception.EventFinalizedException;
import com.teamouting.planner.exception.EventNotFoundException;
import com.teamouting.planner.exception.InvalidPhaseTransitionException;
import com.teamouting.planner.exception.LimitExceededException;
import com.teamouting.planner.exception.UnauthorizedException;
import com.teamouting.planner.model.DateOptionSort;
import com.teamouting.planner.model.DateResponseType;
import com.teamouting.planner.model.EventPhase;
import com.teamouting.planner.model.VoteType;
import com.teamouting.planner.service.EventLifecycleService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = EventController.class)
@TestPropertySource(locations = "classpath:application-test.properties")
@ActiveProfiles("test")
class EventControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private EventLifecycleService lifecycleService;

    private String eventId;
    private String dateOptionId;
    private String userId;

    @BeforeEach
    void setUp() {
        eventId = UUID.randomUUID().toString();
        dateOptionId = UUID.randomUUID().toString();
        userId = "user-123";
    }

    private EventDetailDTO snapshot(EventPhase phase) {
        EventDetailDTO detail = new EventDetailDTO();
        detail.setEventId(eventId);
        detail.setPhase(phase);
        detail.setName("Team outing");
        return detail;
    }

    @Test
    void createEvent_WithValidRequest_ReturnsCreatedSnapshot() throws Exception {
        // Given
        CreateEventRequest request = new CreateEventRequest("room-1", "Team outing", "Friday fun", null,
            List.of("bowling", "karaoke"));
        when(lifecycleService.createEvent(any(CreateEventRequest.class), eq(userId)))
            .thenReturn(snapshot(EventPhase.PROPOSAL));

        // When & Then
        mockMvc.perform(post("/events")
                .requestAttr("userId", userId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.eventId").value(eventId))
                .andExpect(jsonPath("$.phase").value("PROPOSAL"));

        ArgumentCaptor<CreateEventRequest> captor = ArgumentCaptor.forClass(CreateEventRequest.class);
        verify(lifecycleService).createEvent(captor.capture(), eq(userId));
        assertThat(captor.getValue().getProposedActivityIds()).containsExactly("bowling", "karaoke");
    }

    @Test
    void createEvent_WithoutName_ReturnsBadRequest() throws Exception {
        CreateEventRequest request = new CreateEventRequest("room-1", "", null, null, List.of());

        mockMvc.perform(post("/events")
                .requestAttr("userId", userId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));

        verifyNoInteractions(lifecycleService);
    }

    @Test
    void getEvent_WithUserIdHeader_UsesForwardedIdentity() throws Exception {
        when(lifecycleService.getEvent(eventId, "gateway-user")).thenReturn(snapshot(EventPhase.VOTING));

        mockMvc.perform(get("/events/{eventId}", eventId)
                .header("X-User-Id", "gateway-user"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("VOTING"));
    }

    @Test
    void getEvent_WithoutUser_ReturnsForbidden() throws Exception {
        mockMvc.perform(get("/events/{eventId}", eventId))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));

        verifyNoInteractions(lifecycleService);
    }

    @Test
    void getEvent_InvalidEventId_ReturnsBadRequest() throws Exception {
        mockMvc.perform(get("/events/{eventId}", "not-a-valid-id")
                .requestAttr("userId", userId))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(lifecycleService);
    }

    @Test
    void getEvent_Missing_ReturnsNotFound() throws Exception {
        when(lifecycleService.getEvent(eventId, userId)).thenThrow(new EventNotFoundException("Event not found: " + eventId));

        mockMvc.perform(get("/events/{eventId}", eventId)
                .requestAttr("userId", userId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("EVENT_NOT_FOUND"))
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    void castActivityVote_WithValidVote_DelegatesToService() throws Exception {
        // Given
        when(lifecycleService.castActivityVote(eventId, "bowling", userId, VoteType.FOR))
            .thenReturn(snapshot(EventPhase.VOTING));

        // When & Then
        mockMvc.perform(post("/events/{eventId}/votes", eventId)
                .requestAttr("userId", userId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new ActivityVoteRequest("bowling", VoteType.FOR))))
                .andExpect(status().isOk());

        verify(lifecycleService).castActivityVote(eventId, "bowling", userId, VoteType.FOR);
    }

    @Test
    void castActivityVote_UnknownVoteValue_ReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/events/{eventId}/votes", eventId)
                .requestAttr("userId", userId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"activityId\":\"bowling\",\"vote\":\"SOMETIMES\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(lifecycleService);
    }

    @Test
    void castActivityVote_AfterVotingClosed_ReturnsConflict() throws Exception {
        when(lifecycleService.castActivityVote(anyString(), anyString(), anyString(), any(VoteType.class)))
            .thenThrow(new InvalidPhaseTransitionException("Operation not allowed in phase SCHEDULING"));

        mockMvc.perform(post("/events/{eventId}/votes", eventId)
                .requestAttr("userId", userId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new ActivityVoteRequest("bowling", VoteType.AGAINST))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("INVALID_PHASE_TRANSITION"));
    }

    @Test
    void selectWinningActivity_ByNonOrganizer_ReturnsForbidden() throws Exception {
        when(lifecycleService.selectWinningActivity(eventId, "bowling", userId))
            .thenThrow(new UnauthorizedException("Only an organizer can perform this action"));

        mockMvc.perform(post("/events/{eventId}/select-activity", eventId)
                .requestAttr("userId", userId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new SelectActivityRequest("bowling"))))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.message").value("Only an organizer can perform this action"));
    }

    @Test
    void addDateOptions_WithTimes_ParsesBatch() throws Exception {
        // Given
        when(lifecycleService.addDateOptions(eq(eventId), any(AddDateOptionsRequest.class), eq(userId)))
            .thenReturn(snapshot(EventPhase.SCHEDULING));
        String body = "{\"options\":["
            + "{\"date\":\"2026-06-01\",\"startTime\":\"18:00\",\"endTime\":\"21:30\"},"
            + "{\"date\":\"2026-06-02\"}]}";

        // When & Then
        mockMvc.perform(post("/events/{eventId}/date-options", eventId)
                .requestAttr("userId", userId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
                .andExpect(status().isOk());

        ArgumentCaptor<AddDateOptionsRequest> captor = ArgumentCaptor.forClass(AddDateOptionsRequest.class);
        verify(lifecycleService).addDateOptions(eq(eventId), captor.capture(), eq(userId));
        assertThat(captor.getValue().getOptions()).hasSize(2);
        assertThat(captor.getValue().getOptions().get(0).getDate()).isEqualTo(LocalDate.of(2026, 6, 1));
        assertThat(captor.getValue().getOptions().get(0).getEndTime()).isEqualTo(LocalTime.of(21, 30));
        assertThat(captor.getValue().getOptions().get(1).getStartTime()).isNull();
    }

    @Test
    void addDateOptions_EmptyBatch_ReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/events/{eventId}/date-options", eventId)
                .requestAttr("userId", userId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"options\":[]}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(lifecycleService);
    }

    @Test
    void addDateOptions_OverCap_ReturnsConflict() throws Exception {
        when(lifecycleService.addDateOptions(eq(eventId), any(AddDateOptionsRequest.class), eq(userId)))
            .thenThrow(new LimitExceededException("Maximum 10 date options allowed"));

        mockMvc.perform(post("/events/{eventId}/date-options", eventId)
                .requestAttr("userId", userId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"options\":[{\"date\":\"2026-06-01\"}]}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("LIMIT_EXCEEDED"));
    }

    @Test
    void addDateOptions_Duplicate_ReturnsConflict() throws Exception {
        when(lifecycleService.addDateOptions(eq(eventId), any(AddDateOptionsRequest.class), eq(userId)))
            .thenThrow(new DuplicateDateOptionException("Date option 2026-06-01 (all day) already proposed"));

        mockMvc.perform(post("/events/{eventId}/date-options", eventId)
                .requestAttr("userId", userId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"options\":[{\"date\":\"2026-06-01\"}]}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("DUPLICATE_DATE_OPTION"));
    }

    @Test
    void respondToDateOption_AfterFinalize_ReturnsConflict() throws Exception {
        when(lifecycleService.respondToDateOption(eq(eventId), eq(dateOptionId), eq(userId), any(DateResponseRequest.class)))
            .thenThrow(new EventFinalizedException("Event " + eventId + " is finalized"));

        mockMvc.perform(put("/events/{eventId}/date-options/{dateOptionId}/response", eventId, dateOptionId)
                .requestAttr("userId", userId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new DateResponseRequest(DateResponseType.YES, true))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("EVENT_FINALIZED"));
    }

    @Test
    void respondToDateOption_NegativeContribution_ReturnsBadRequest() throws Exception {
        mockMvc.perform(put("/events/{eventId}/date-options/{dateOptionId}/response", eventId, dateOptionId)
                .requestAttr("userId", userId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"response\":\"YES\",\"contribution\":-5}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(lifecycleService);
    }

    @Test
    void finalizeDateOption_WhenBusy_ReturnsConflictWithRetryAfter() throws Exception {
        when(lifecycleService.finalizeDateOption(eventId, dateOptionId, userId))
            .thenThrow(new EventBusyException("Event " + eventId + " is busy, please retry"));

        mockMvc.perform(post("/events/{eventId}/finalize-date", eventId)
                .requestAttr("userId", userId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new FinalizeDateRequest(dateOptionId))))
                .andExpect(status().isConflict())
                .andExpect(header().string("Retry-After", "1"))
                .andExpect(jsonPath("$.error").value("EVENT_BUSY"));
    }

    @Test
    void getRankedDateOptions_Chronological_PassesSort() throws Exception {
        // Given
        DateOptionDTO option = new DateOptionDTO(dateOptionId, LocalDate.of(2026, 6, 1), LocalTime.of(18, 0), null,
            5, false, List.of());
        when(lifecycleService.getRankedDateOptions(eventId, DateOptionSort.CHRONOLOGICAL, userId))
            .thenReturn(List.of(option));

        // When & Then
        mockMvc.perform(get("/events/{eventId}/date-options", eventId)
                .param("sort", "CHRONOLOGICAL")
                .requestAttr("userId", userId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].dateOptionId").value(dateOptionId))
                .andExpect(jsonPath("$[0].score").value(5))
                .andExpect(jsonPath("$[0].startTime").value("18:00"));
    }

    @Test
    void getRankedDateOptions_DefaultsToScore() throws Exception {
        when(lifecycleService.getRankedDateOptions(eventId, DateOptionSort.SCORE, userId)).thenReturn(List.of());

        mockMvc.perform(get("/events/{eventId}/date-options", eventId)
                .requestAttr("userId", userId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    void getRankedDateOptions_UnknownSort_ReturnsBadRequest() throws Exception {
        mockMvc.perform(get("/events/{eventId}/date-options", eventId)
                .param("sort", "RANDOM")
                .requestAttr("userId", userId))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(lifecycleService);
    }

    @Test
    void openVoting_DelegatesToService() throws Exception {
        when(lifecycleService.openVoting(eventId, userId)).thenReturn(snapshot(EventPhase.VOTING));

        mockMvc.perform(post("/events/{eventId}/open-voting", eventId)
                .requestAttr("userId", userId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.phase").value("VOTING"));
    }

    @Test
    void excludeActivity_DelegatesToService() throws Exception {
        when(lifecycleService.excludeActivity(eventId, "karaoke", userId)).thenReturn(snapshot(EventPhase.VOTING));

        mockMvc.perform(post("/events/{eventId}/activities/{activityId}/exclude", eventId, "karaoke")
                .requestAttr("userId", userId))
                .andExpect(status().isOk());

        verify(lifecycleService).excludeActivity(eventId, "karaoke", userId);
    }

    @Test
    void proposeActivities_ReplacesList() throws Exception {
        when(lifecycleService.proposeActivities(eventId, List.of("hike", "picnic"), userId))
            .thenReturn(snapshot(EventPhase.PROPOSAL));

        mockMvc.perform(put("/events/{eventId}/activities", eventId)
                .requestAttr("userId", userId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"activityIds\":[\"hike\",\"picnic\"]}"))
                .andExpect(status().isOk());

        verify(lifecycleService).proposeActivities(eventId, List.of("hike", "picnic"), userId);
    }
}
