package com.egg.controller;

import com.egg.dto.request.EventCreateRequest;
import com.egg.dto.request.EventUpdateRequest;
import com.egg.dto.response.EventAiStateResponse;
import com.egg.dto.response.EventResponse;
import com.egg.dto.response.EventStatusResponse;
import com.egg.dto.response.LinkedIdeaResponse;
import com.egg.security.AuthenticatedUser;
import com.egg.service.EventService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * REST controller for event ingestion.
 *
 * Endpoints:
 * - POST  /v1/events                           - store an event and schedule it
 * - PATCH /v1/events/{id}                      - partial update, reschedules the event
 * - GET   /v1/events/{id}                      - event details
 * - GET   /v1/events/{id}/status               - {"status": "pending|transcribing|processed|failed"}
 * - GET   /v1/debug/events/{id}/ai-state       - pipeline diagnostics (404 unless enabled)
 * - GET   /v1/debug/events/{id}/linked-idea    - idea linked to the event (404 unless enabled)
 *
 * Writes return as soon as the event is stored. Transcription and extraction run
 * asynchronously; clients poll the status endpoint.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class EventController {

    private final EventService eventService;

    @PostMapping("/v1/events")
    public ResponseEntity<EventResponse> create(
            @Valid @RequestBody EventCreateRequest request,
            Authentication authentication) {

        log.info("Event ingestion: deviceId={}, userId={}", request.getDeviceId(), authentication.getName());
        return ResponseEntity.ok(eventService.create(AuthenticatedUser.id(authentication), request));
    }

    @PatchMapping("/v1/events/{id}")
    public ResponseEntity<EventResponse> update(
            @PathVariable UUID id,
            @Valid @RequestBody EventUpdateRequest request,
            Authentication authentication) {

        log.info("Event update: eventId={}, userId={}", id, authentication.getName());
        return ResponseEntity.ok(eventService.update(AuthenticatedUser.id(authentication), id, request));
    }

    @GetMapping("/v1/events/{id}")
    public ResponseEntity<EventResponse> get(@PathVariable UUID id, Authentication authentication) {
        return ResponseEntity.ok(eventService.get(AuthenticatedUser.id(authentication), id));
    }

    @GetMapping("/v1/events/{id}/status")
    public ResponseEntity<EventStatusResponse> status(@PathVariable UUID id, Authentication authentication) {
        return ResponseEntity.ok(eventService.getStatus(AuthenticatedUser.id(authentication), id));
    }

    @GetMapping("/v1/debug/events/{id}/ai-state")
    public ResponseEntity<EventAiStateResponse> aiState(@PathVariable UUID id, Authentication authentication) {
        log.debug("AI state requested: eventId={}, userId={}", id, authentication.getName());
        return ResponseEntity.ok(eventService.getAiState(AuthenticatedUser.id(authentication), id));
    }

    @GetMapping("/v1/debug/events/{id}/linked-idea")
    public ResponseEntity<LinkedIdeaResponse> linkedIdea(@PathVariable UUID id, Authentication authentication) {
        log.debug("Linked idea requested: eventId={}, userId={}", id, authentication.getName());
        return ResponseEntity.ok(eventService.getLinkedIdea(AuthenticatedUser.id(authentication), id));
    }
}
