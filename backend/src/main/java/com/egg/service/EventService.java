package com.egg.service;

import com.egg.config.PipelineProperties;
import com.egg.dto.request.EventCreateRequest;
import com.egg.dto.request.EventUpdateRequest;
import com.egg.dto.response.EventAiStateResponse;
import com.egg.dto.response.EventResponse;
import com.egg.dto.response.EventStatusResponse;
import com.egg.dto.response.LinkedIdeaResponse;
import com.egg.entity.EggbookIdea;
import com.egg.entity.Event;
import com.egg.entity.Event.EventStatus;
import com.egg.exception.ResourceNotFoundException;
import com.egg.pipeline.AggregationScheduler;
import com.egg.pipeline.BatchWindowRegistry;
import com.egg.pipeline.BatchWindowRegistry.WindowState;
import com.egg.pipeline.CooldownGate;
import com.egg.pipeline.CooldownGate.GateState;
import com.egg.pipeline.TriggerPath;
import com.egg.repository.DeviceRepository;
import com.egg.repository.EggbookIdeaRepository;
import com.egg.repository.EventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Event ingestion and lookup.
 *
 * Create and update both store the event first and only then hand it to the
 * {@link AggregationScheduler}, so the pipeline always reads committed data.
 * Updates hold the event's row lock until commit, so they serialize with the
 * pipeline's status transitions instead of overwriting them.
 * The HTTP call returns as soon as the event is stored; AI work runs on the queue consumer.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EventService {

    private final EventRepository eventRepository;
    private final DeviceRepository deviceRepository;
    private final EggbookIdeaRepository ideaRepository;
    private final AggregationScheduler aggregationScheduler;
    private final BatchWindowRegistry windows;
    private final CooldownGate cooldownGate;
    private final PipelineProperties properties;
    private final Clock clock;

    /**
     * Store a new pending event and schedule it.
     *
     * @throws ResourceNotFoundException if the device is not registered to the user
     */
    public EventResponse create(UUID userId, EventCreateRequest request) {
        deviceRepository.findByIdAndUserId(request.getDeviceId(), userId)
                .orElseThrow(() -> ResourceNotFoundException.of("Device"));

        Event event = new Event();
        event.setUserId(userId);
        event.setDeviceId(request.getDeviceId());
        event.setAudioUrl(blankToNull(request.getAudioUrl()));
        event.setScreenRecordingReference(blankToNull(
                request.getScreenRecordingUrl() != null ? request.getScreenRecordingUrl() : request.getRecordingUrl()));
        event.setTranscript(request.getTranscript());
        event.setDurationSec(request.getDurationSec() != null ? request.getDurationSec() : 0d);
        event.setEventAt(request.getEventAt() != null ? request.getEventAt() : LocalDateTime.now(clock));
        event.setStatus(EventStatus.PENDING);

        Event saved = eventRepository.save(event);
        log.info("Event created: eventId={}, userId={}, deviceId={}", saved.getId(), userId, saved.getDeviceId());

        aggregationScheduler.onEventChanged(saved);
        return toResponse(saved);
    }

    /**
     * Apply a partial update and reschedule the event.
     *
     * Without an explicit status the event goes back to pending so it is processed again.
     * An event carrying a screen recording gets a placeholder idea linked to it, or has
     * its placeholder's media references refreshed. Scheduling happens after commit.
     *
     * @throws ResourceNotFoundException if the event does not exist or belongs to another user
     * @throws IllegalArgumentException if the status value is unknown
     */
    @Transactional
    public EventResponse update(UUID userId, UUID eventId, EventUpdateRequest request) {
        Event event = eventRepository.findByIdForUpdate(eventId)
                .filter(found -> userId.equals(found.getUserId()))
                .orElseThrow(() -> ResourceNotFoundException.of("Event"));

        EventStatus explicitStatus = request.getStatus() != null ? EventStatus.fromValue(request.getStatus()) : null;

        if (request.getAudioUrl() != null) {
            event.setAudioUrl(request.getAudioUrl());
        }
        if (request.getScreenRecordingUrl() != null) {
            event.setScreenRecordingReference(request.getScreenRecordingUrl());
        } else if (request.getRecordingUrl() != null) {
            event.setScreenRecordingReference(request.getRecordingUrl());
        }
        if (request.getTranscript() != null) {
            event.setTranscript(request.getTranscript());
        }
        if (request.getDurationSec() != null) {
            event.setDurationSec(request.getDurationSec());
        }
        if (request.getEventAt() != null) {
            event.setEventAt(request.getEventAt());
        }
        event.setStatus(explicitStatus != null ? explicitStatus : EventStatus.PENDING);

        Event saved = eventRepository.save(event);
        log.info("Event updated: eventId={}, userId={}, status={}", eventId, userId, saved.getStatus());

        if (saved.hasScreenRecording()) {
            linkPlaceholderIdea(saved);
        }

        afterCommit(() -> aggregationScheduler.onEventChanged(saved));
        return toResponse(saved);
    }

    /**
     * Create the event's placeholder idea, or point the existing one at the event's current media.
     */
    void linkPlaceholderIdea(Event event) {
        EggbookIdea idea = ideaRepository
                .findFirstByUserIdAndSourceEventIdOrderByCreatedAtAsc(event.getUserId(), event.getId())
                .orElse(null);
        if (idea == null) {
            idea = new EggbookIdea();
            idea.setUserId(event.getUserId());
            idea.setSourceEventId(event.getId());
            log.info("Placeholder idea created: eventId={}, userId={}", event.getId(), event.getUserId());
        }
        idea.setScreenRecordingUrl(event.screenRecordingReference());
        idea.setRecordingUrl(event.getRecordingUrl());
        idea.setAudioUrl(event.getAudioUrl());
        ideaRepository.save(idea);
    }

    public EventResponse get(UUID userId, UUID eventId) {
        return toResponse(findOwned(userId, eventId));
    }

    public EventStatusResponse getStatus(UUID userId, UUID eventId) {
        return new EventStatusResponse(findOwned(userId, eventId).getStatus().value());
    }

    /**
     * Diagnostic view of the event's path through the pipeline.
     *
     * @throws ResourceNotFoundException when diagnostics are disabled, or the event is not the user's
     */
    public EventAiStateResponse getAiState(UUID userId, UUID eventId) {
        if (!properties.isDebugEnabled()) {
            throw new ResourceNotFoundException("Not Found");
        }
        Event event = findOwned(userId, eventId);

        TriggerPath path = aggregationScheduler.classify(event);
        WindowState window = windows.snapshot(userId);
        GateState gate = cooldownGate.state(userId);
        long pending = eventRepository.countByUserIdAndStatusIn(
                userId, List.of(EventStatus.PENDING, EventStatus.TRANSCRIBING));

        return EventAiStateResponse.builder()
                .eventId(event.getId())
                .userId(userId)
                .status(event.getStatus().value())
                .eventAt(event.getEventAt())
                .updatedAt(event.getUpdatedAt())
                .triggerPath(path.name())
                .signals(EventAiStateResponse.Signals.builder()
                        .hasAudioUrl(event.hasAudio())
                        .hasScreenRecordingUrl(event.hasScreenRecording())
                        .hasTranscript(event.hasTranscript())
                        .build())
                .batchWindow(EventAiStateResponse.BatchWindow.builder()
                        .queued(windows.contains(userId, eventId))
                        .size(window.size())
                        .triggerCount(properties.getBatchTriggerCount())
                        .maxWaitHours(properties.getBatchMaxWaitHours())
                        .oldestEventAt(window.oldestEventAt())
                        .countReached(window.countReached())
                        .waitExceeded(window.waitExceeded())
                        .build())
                .runtime(EventAiStateResponse.GateState.builder()
                        .userProcessing(gate.processing())
                        .cooldownRemainingSec((long) Math.ceil(gate.cooldownRemaining().toMillis() / 1000.0))
                        .pendingEvents(pending)
                        .build())
                .probableReason(probableReason(event, path, window, gate))
                .build();
    }

    /**
     * Diagnostic view of the idea linked to an event, if any.
     *
     * @throws ResourceNotFoundException when diagnostics are disabled, or the event is not the user's
     */
    public LinkedIdeaResponse getLinkedIdea(UUID userId, UUID eventId) {
        if (!properties.isDebugEnabled()) {
            throw new ResourceNotFoundException("Not Found");
        }
        Event event = findOwned(userId, eventId);

        LinkedIdeaResponse.LinkedIdea linked = ideaRepository
                .findFirstByUserIdAndSourceEventIdOrderByCreatedAtAsc(userId, event.getId())
                .map(idea -> LinkedIdeaResponse.LinkedIdea.builder()
                        .id(idea.getId())
                        .placeholder(idea.isPlaceholder())
                        .title(idea.getTitle())
                        .content(idea.getContent())
                        .screenRecordingUrl(idea.getScreenRecordingUrl())
                        .recordingUrl(idea.getRecordingUrl())
                        .audioUrl(idea.getAudioUrl())
                        .createdAt(idea.getCreatedAt())
                        .updatedAt(idea.getUpdatedAt())
                        .build())
                .orElse(null);
        return new LinkedIdeaResponse(event.getId(), linked);
    }

    String probableReason(Event event, TriggerPath path, WindowState window, GateState gate) {
        switch (event.getStatus()) {
            case PROCESSED:
                return "Processed successfully";
            case FAILED:
                return "Last AI/STT attempt failed";
            case TRANSCRIBING:
                return "AI/STT in progress, or awaiting recovery by the sweep";
            default:
                break;
        }
        if (path == TriggerPath.NONE) {
            return "Event not eligible for extraction rules";
        }
        if (gate.processing()) {
            return "User AI queue is currently processing";
        }
        if (!gate.cooldownRemaining().isZero()) {
            return "User AI queue cooldown active";
        }
        if (path == TriggerPath.TRANSCRIPTION) {
            return "Waiting for transcription";
        }
        if (path == TriggerPath.BATCH_INFERENCE && !window.flushable()) {
            return "Waiting for input batch trigger threshold";
        }
        return "Ready, waiting for the next pipeline run";
    }

    private Event findOwned(UUID userId, UUID eventId) {
        return eventRepository.findByIdAndUserId(eventId, userId)
                .orElseThrow(() -> ResourceNotFoundException.of("Event"));
    }

    private EventResponse toResponse(Event event) {
        String screenRecording = event.screenRecordingReference();
        return EventResponse.builder()
                .eventId(event.getId())
                .deviceId(event.getDeviceId())
                .recordingUrl(screenRecording)
                .audioUrl(event.getAudioUrl())
                .screenRecordingUrl(screenRecording)
                .transcript(event.getTranscript())
                .durationSec(event.getDurationSec() != null ? event.getDurationSec().longValue() : 0L)
                .eventAt(event.getEventAt())
                .status(event.getStatus().value())
                .createdAt(event.getCreatedAt())
                .updatedAt(event.getUpdatedAt())
                .build();
    }

    private static void afterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
