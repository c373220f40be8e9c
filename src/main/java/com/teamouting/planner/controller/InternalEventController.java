package com.teamouting.planner.controller;

import com.teamouting.planner.dto.AddParticipantRequest;
import com.teamouting.planner.dto.EventDetailDTO;
import com.teamouting.planner.service.EventLifecycleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;

/**
 * Internal endpoints called by the room membership service.
 * Protected by InternalApiKeyFilter (X-Api-Key header).
 */
@RestController
@RequestMapping("/internal/events")
@Validated
@Tag(name = "Internal", description = "Service-to-service event endpoints")
public class InternalEventController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(InternalEventController.class);

    private final EventLifecycleService lifecycleService;

    @Autowired
    public InternalEventController(EventLifecycleService lifecycleService) {
        this.lifecycleService = lifecycleService;
    }

    @PostMapping("/{eventId}/participants")
    @Operation(summary = "Register a room member on an event")
    public ResponseEntity<EventDetailDTO> addParticipant(
            @PathVariable @Pattern(regexp = "[0-9a-f-]{36}", message = "Invalid event ID format") String eventId,
            @Valid @RequestBody AddParticipantRequest request) {

        logger.info("Membership sync: user {} on event {} (organizer={})",
                request.getUserId(), eventId, request.isOrganizer());
        return ResponseEntity.ok(lifecycleService.addParticipant(eventId, request.getUserId(), request.isOrganizer()));
    }
}
