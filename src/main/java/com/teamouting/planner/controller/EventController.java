package com.teamouting.planner.controller;

import com.teamouting.planner.dto.ActivityVoteRequest;
import com.teamouting.planner.dto.AddDateOptionsRequest;
import com.teamouting.planner.dto.CreateEventRequest;
import com.teamouting.planner.dto.DateOptionDTO;
import com.teamouting.planner.dto.DateResponseRequest;
import com.teamouting.planner.dto.EventDetailDTO;
import com.teamouting.planner.dto.FinalizeDateRequest;
import com.teamouting.planner.dto.ProposeActivitiesRequest;
import com.teamouting.planner.dto.SelectActivityRequest;
import com.teamouting.planner.model.DateOptionSort;
import com.teamouting.planner.service.EventLifecycleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import java.util.List;

/**
 * REST controller for the outing event lifecycle: activity proposals and votes, date options and
 * responses, and the organizer decisions that move an event forward.
 * Every mutation returns the full event snapshot.
 */
@RestController
@RequestMapping("/events")
@Validated
@Tag(name = "Events", description = "Outing event lifecycle and consensus")
public class EventController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(EventController.class);

    private final EventLifecycleService lifecycleService;

    @Autowired
    public EventController(EventLifecycleService lifecycleService) {
        this.lifecycleService = lifecycleService;
    }

    @PostMapping
    @Operation(summary = "Create an event in the proposal phase with the caller as organizer")
    public ResponseEntity<EventDetailDTO> createEvent(
            @Valid @RequestBody CreateEventRequest request,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        logger.info("Creating event '{}' in room {} by user {}", request.getName(), request.getRoomId(), userId);

        EventDetailDTO event = lifecycleService.createEvent(request, userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(event);
    }

    @GetMapping("/{eventId}")
    @Operation(summary = "Get the current event snapshot")
    public ResponseEntity<EventDetailDTO> getEvent(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid event ID format") String eventId,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(lifecycleService.getEvent(eventId, userId));
    }

    @PutMapping("/{eventId}/activities")
    @Operation(summary = "Replace the proposed activities (proposal phase)")
    public ResponseEntity<EventDetailDTO> proposeActivities(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid event ID format") String eventId,
            @Valid @RequestBody ProposeActivitiesRequest request,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(lifecycleService.proposeActivities(eventId, request.getActivityIds(), userId));
    }

    @DeleteMapping("/{eventId}/activities/{activityId}")
    @Operation(summary = "Remove a proposed activity (organizer, proposal phase)")
    public ResponseEntity<EventDetailDTO> removeProposedActivity(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid event ID format") String eventId,
            @PathVariable String activityId,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(lifecycleService.removeProposedActivity(eventId, activityId, userId));
    }

    @PostMapping("/{eventId}/activities/{activityId}/exclude")
    @Operation(summary = "Exclude an activity from voting (organizer)")
    public ResponseEntity<EventDetailDTO> excludeActivity(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid event ID format") String eventId,
            @PathVariable String activityId,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(lifecycleService.excludeActivity(eventId, activityId, userId));
    }

    @PostMapping("/{eventId}/activities/{activityId}/include")
    @Operation(summary = "Bring an excluded activity back into voting (organizer)")
    public ResponseEntity<EventDetailDTO> includeActivity(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid event ID format") String eventId,
            @PathVariable String activityId,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(lifecycleService.includeActivity(eventId, activityId, userId));
    }

    @PostMapping("/{eventId}/open-voting")
    @Operation(summary = "Close proposals and open activity voting (organizer)")
    public ResponseEntity<EventDetailDTO> openVoting(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid event ID format") String eventId,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(lifecycleService.openVoting(eventId, userId));
    }

    @PostMapping("/{eventId}/votes")
    @Operation(summary = "Cast or replace the caller's vote on an activity")
    public ResponseEntity<EventDetailDTO> castActivityVote(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid event ID format") String eventId,
            @Valid @RequestBody ActivityVoteRequest request,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(lifecycleService.castActivityVote(eventId, request.getActivityId(), userId, request.getVote()));
    }

    @PostMapping("/{eventId}/select-activity")
    @Operation(summary = "Choose the winning activity and start scheduling (organizer)")
    public ResponseEntity<EventDetailDTO> selectWinningActivity(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid event ID format") String eventId,
            @Valid @RequestBody SelectActivityRequest request,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(lifecycleService.selectWinningActivity(eventId, request.getActivityId(), userId));
    }

    @PostMapping("/{eventId}/date-options")
    @Operation(summary = "Add a batch of candidate dates (all or nothing)")
    public ResponseEntity<EventDetailDTO> addDateOptions(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid event ID format") String eventId,
            @Valid @RequestBody AddDateOptionsRequest request,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(lifecycleService.addDateOptions(eventId, request, userId));
    }

    @GetMapping("/{eventId}/date-options")
    @Operation(summary = "List date options ranked by consensus score or chronologically")
    public ResponseEntity<List<DateOptionDTO>> getRankedDateOptions(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid event ID format") String eventId,
            @RequestParam(defaultValue = "SCORE") DateOptionSort sort,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        List<DateOptionDTO> options = lifecycleService.getRankedDateOptions(eventId, sort, userId);
        logger.debug("Returning {} date options for event {}", options.size(), eventId);
        return ResponseEntity.ok(options);
    }

    @PutMapping("/{eventId}/date-options/{dateOptionId}/response")
    @Operation(summary = "Set the caller's response on a date option")
    public ResponseEntity<EventDetailDTO> respondToDateOption(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid event ID format") String eventId,
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid date option ID format") String dateOptionId,
            @Valid @RequestBody DateResponseRequest request,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(lifecycleService.respondToDateOption(eventId, dateOptionId, userId, request));
    }

    @PostMapping("/{eventId}/finalize-date")
    @Operation(summary = "Finalize the event date (organizer)")
    public ResponseEntity<EventDetailDTO> finalizeDateOption(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid event ID format") String eventId,
            @Valid @RequestBody FinalizeDateRequest request,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        return ResponseEntity.ok(lifecycleService.finalizeDateOption(eventId, request.getDateOptionId(), userId));
    }
}
