package com.egg.service;

import com.egg.config.PipelineProperties;
import com.egg.dto.request.EventCreateRequest;
import com.egg.dto.request.EventUpdateRequest;
import com.egg.dto.response.EventAiStateResponse;
import com.egg.dto.response.EventResponse;
import com.egg.dto.response.LinkedIdeaResponse;
import com.egg.entity.Device;
import com.egg.entity.EggbookIdea;
import com.egg.entity.Event;
import com.egg.entity.Event.EventStatus;
import com.egg.exception.ResourceNotFoundException;
import com.egg.pipeline.AggregationScheduler;
import com.egg.pipeline.BatchWindowRegistry;
import com.egg.pipeline.CooldownGate;
import com.egg.pipeline.TriggerPath;
import com.egg.repository.DeviceRepository;
import com.egg.repository.EggbookIdeaRepository;
import com.egg.repository.EventRepository;
import com.egg.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for EventService.
 *
 * Tests event ingestion including:
 * - Device ownership checks
 * - Legacy recording_url alias handling
 * - Row-locked updates, rescheduling after commit and status parsing
 * - Placeholder ideas for screen recordings
 * - The diagnostics switch (AI state, linked idea)
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("EventService Unit Tests")
class EventServiceTest {

    @Mock
    private EventRepository eventRepository;

    @Mock
    private DeviceRepository deviceRepository;

    @Mock
    private AggregationScheduler aggregationScheduler;

    @Mock
    private CooldownGate cooldownGate;

    @Mock
    private EggbookIdeaRepository ideaRepository;

    private MutableClock clock;
    private PipelineProperties properties;
    private BatchWindowRegistry windows;
    private EventService eventService;
    private UUID userId;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-02T10:00:00Z");
        properties = new PipelineProperties();
        windows = new BatchWindowRegistry(properties, clock);
        eventService = new EventService(eventRepository, deviceRepository, ideaRepository, aggregationScheduler, windows,
                cooldownGate, properties, clock);
        userId = UUID.randomUUID();
    }

    private Event storedEvent() {
        Event event = new Event();
        event.setId(UUID.randomUUID());
        event.setUserId(userId);
        event.setDeviceId("device-1");
        event.setTranscript("old transcript");
        event.setEventAt(LocalDateTime.now(clock).minusHours(1));
        event.setStatus(EventStatus.PROCESSED);
        return event;
    }

    @Test
    @DisplayName("create should store a pending event and schedule it")
    void testCreate_Success() {
        // Arrange
        EventCreateRequest request = new EventCreateRequest("device-1", "https://cdn.example.com/a.m4a",
                null, "https://cdn.example.com/legacy.mp4", null, 42.7, null);
        when(deviceRepository.findByIdAndUserId("device-1", userId)).thenReturn(Optional.of(new Device()));
        when(eventRepository.save(any(Event.class))).thenAnswer(invocation -> {
            Event event = invocation.getArgument(0);
            event.setId(UUID.randomUUID());
            return event;
        });

        // Act
        EventResponse response = eventService.create(userId, request);

        // Assert
        assertEquals("pending", response.getStatus());
        assertEquals("https://cdn.example.com/legacy.mp4", response.getScreenRecordingUrl());
        assertEquals("https://cdn.example.com/legacy.mp4", response.getRecordingUrl());
        assertEquals(42L, response.getDurationSec());
        assertEquals(LocalDateTime.now(clock), response.getEventAt());

        ArgumentCaptor<Event> captor = ArgumentCaptor.forClass(Event.class);
        verify(aggregationScheduler).onEventChanged(captor.capture());
        assertEquals("https://cdn.example.com/legacy.mp4", captor.getValue().getScreenRecordingUrl());
    }

    @Test
    @DisplayName("create should reject a device not registered to the user")
    void testCreate_UnknownDevice() {
        // Arrange
        EventCreateRequest request = new EventCreateRequest();
        request.setDeviceId("someone-elses-device");
        when(deviceRepository.findByIdAndUserId("someone-elses-device", userId)).thenReturn(Optional.empty());

        // Act & Assert
        assertThrows(ResourceNotFoundException.class, () -> eventService.create(userId, request));
        verify(eventRepository, never()).save(any());
        verifyNoInteractions(aggregationScheduler);
    }

    @Test
    @DisplayName("update without status should put the event back to pending and reschedule it")
    void testUpdate_ResetsToPending() {
        // Arrange
        Event event = storedEvent();
        EventUpdateRequest request = new EventUpdateRequest();
        request.setTranscript("new transcript");
        when(eventRepository.findByIdForUpdate(event.getId())).thenReturn(Optional.of(event));
        when(eventRepository.save(event)).thenReturn(event);

        // Act
        EventResponse response = eventService.update(userId, event.getId(), request);

        // Assert
        assertEquals("pending", response.getStatus());
        assertEquals("new transcript", response.getTranscript());
        verify(aggregationScheduler).onEventChanged(event);
    }

    @Test
    @DisplayName("update with an explicit status should keep that status")
    void testUpdate_ExplicitStatus() {
        // Arrange
        Event event = storedEvent();
        EventUpdateRequest request = new EventUpdateRequest();
        request.setStatus("FAILED");
        when(eventRepository.findByIdForUpdate(event.getId())).thenReturn(Optional.of(event));
        when(eventRepository.save(event)).thenReturn(event);

        // Act
        EventResponse response = eventService.update(userId, event.getId(), request);

        // Assert
        assertEquals("failed", response.getStatus());
    }

    @Test
    @DisplayName("update with an unknown status should fail before changing the event")
    void testUpdate_InvalidStatus() {
        // Arrange
        Event event = storedEvent();
        EventUpdateRequest request = new EventUpdateRequest();
        request.setStatus("done");
        request.setTranscript("changed");
        when(eventRepository.findByIdForUpdate(event.getId())).thenReturn(Optional.of(event));

        // Act & Assert
        assertThrows(IllegalArgumentException.class, () -> eventService.update(userId, event.getId(), request));
        assertEquals("old transcript", event.getTranscript());
        verify(eventRepository, never()).save(any());
    }

    @Test
    @DisplayName("getStatus should return 404 for an event of another user")
    void testGetStatus_OtherUser() {
        // Arrange
        UUID eventId = UUID.randomUUID();
        when(eventRepository.findByIdAndUserId(eventId, userId)).thenReturn(Optional.empty());

        // Act & Assert
        assertThrows(ResourceNotFoundException.class, () -> eventService.getStatus(userId, eventId));
    }

    @Test
    @DisplayName("getAiState should be hidden while diagnostics are disabled")
    void testGetAiState_Disabled() {
        // Act & Assert
        assertThrows(ResourceNotFoundException.class, () -> eventService.getAiState(userId, UUID.randomUUID()));
        verifyNoInteractions(eventRepository);
    }

    @Test
    @DisplayName("getAiState should report window, gate and a probable reason")
    void testGetAiState_Enabled() {
        // Arrange
        properties.setDebugEnabled(true);
        Event event = storedEvent();
        event.setStatus(EventStatus.PENDING);
        windows.offer(userId, event.getId(), event.getEventAt());
        when(eventRepository.findByIdAndUserId(event.getId(), userId)).thenReturn(Optional.of(event));
        when(aggregationScheduler.classify(event)).thenReturn(TriggerPath.BATCH_INFERENCE);
        when(cooldownGate.state(userId)).thenReturn(new CooldownGate.GateState(false, Duration.ZERO));
        when(eventRepository.countByUserIdAndStatusIn(any(), any())).thenReturn(1L);

        // Act
        EventAiStateResponse state = eventService.getAiState(userId, event.getId());

        // Assert
        assertEquals("BATCH_INFERENCE", state.getTriggerPath());
        assertTrue(state.getBatchWindow().isQueued());
        assertEquals(1, state.getBatchWindow().getSize());
        assertEquals(1L, state.getRuntime().getPendingEvents());
        assertEquals("Waiting for input batch trigger threshold", state.getProbableReason());
    }

    @Test
    @DisplayName("probableReason should explain cooldown and in-progress runs")
    void testProbableReason() {
        // Arrange
        Event event = storedEvent();
        event.setStatus(EventStatus.PENDING);
        BatchWindowRegistry.WindowState empty = new BatchWindowRegistry.WindowState(0, null, false, false);

        // Act & Assert
        assertEquals("User AI queue is currently processing", eventService.probableReason(
                event, TriggerPath.SINGLE_INFERENCE, empty, new CooldownGate.GateState(true, Duration.ZERO)));
        assertEquals("User AI queue cooldown active", eventService.probableReason(
                event, TriggerPath.SINGLE_INFERENCE, empty, new CooldownGate.GateState(false, Duration.ofSeconds(3))));
        assertEquals("Waiting for transcription", eventService.probableReason(
                event, TriggerPath.TRANSCRIPTION, empty, new CooldownGate.GateState(false, Duration.ZERO)));

        event.setStatus(EventStatus.FAILED);
        assertEquals("Last AI/STT attempt failed", eventService.probableReason(
                event, TriggerPath.BATCH_INFERENCE, empty, new CooldownGate.GateState(false, Duration.ZERO)));
    }

    @Test
    @DisplayName("update should return 404 for an event of another user and leave it untouched")
    void testUpdate_OtherUser() {
        // Arrange
        Event event = storedEvent();
        event.setUserId(UUID.randomUUID());
        EventUpdateRequest request = new EventUpdateRequest();
        request.setTranscript("hijacked");
        when(eventRepository.findByIdForUpdate(event.getId())).thenReturn(Optional.of(event));

        // Act & Assert
        assertThrows(ResourceNotFoundException.class, () -> eventService.update(userId, event.getId(), request));
        assertEquals("old transcript", event.getTranscript());
        verify(eventRepository, never()).save(any());
        verify(eventRepository, never()).findByIdAndUserId(any(), any());
        verifyNoInteractions(aggregationScheduler);
    }

    @Test
    @DisplayName("update inside a transaction should reschedule the event only after commit")
    void testUpdate_SchedulesAfterCommit() {
        // Arrange
        Event event = storedEvent();
        EventUpdateRequest request = new EventUpdateRequest();
        request.setTranscript("new transcript");
        when(eventRepository.findByIdForUpdate(event.getId())).thenReturn(Optional.of(event));
        when(eventRepository.save(event)).thenReturn(event);

        TransactionSynchronizationManager.initSynchronization();
        try {
            // Act
            eventService.update(userId, event.getId(), request);

            // Assert
            verifyNoInteractions(aggregationScheduler);
            TransactionSynchronizationManager.getSynchronizations().forEach(TransactionSynchronization::afterCommit);
            verify(aggregationScheduler).onEventChanged(event);
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    @Test
    @DisplayName("update attaching a screen recording should create a placeholder idea linked to the event")
    void testUpdate_CreatesPlaceholderIdea() {
        // Arrange
        Event event = storedEvent();
        EventUpdateRequest request = new EventUpdateRequest();
        request.setScreenRecordingUrl("https://cdn.example.com/screen.mp4");
        when(eventRepository.findByIdForUpdate(event.getId())).thenReturn(Optional.of(event));
        when(eventRepository.save(event)).thenReturn(event);
        when(ideaRepository.findFirstByUserIdAndSourceEventIdOrderByCreatedAtAsc(userId, event.getId()))
                .thenReturn(Optional.empty());

        // Act
        eventService.update(userId, event.getId(), request);

        // Assert
        ArgumentCaptor<EggbookIdea> idea = ArgumentCaptor.forClass(EggbookIdea.class);
        verify(ideaRepository).save(idea.capture());
        assertEquals(userId, idea.getValue().getUserId());
        assertEquals(event.getId(), idea.getValue().getSourceEventId());
        assertEquals("https://cdn.example.com/screen.mp4", idea.getValue().getScreenRecordingUrl());
        assertEquals("https://cdn.example.com/screen.mp4", idea.getValue().getRecordingUrl());
        assertTrue(idea.getValue().isPlaceholder());
    }

    @Test
    @DisplayName("update of a recorded event should refresh its existing placeholder instead of adding one")
    void testUpdate_RefreshesPlaceholderIdea() {
        // Arrange
        Event event = storedEvent();
        event.setScreenRecordingReference("https://cdn.example.com/old.mp4");
        EggbookIdea existing = new EggbookIdea();
        existing.setId(UUID.randomUUID());
        existing.setUserId(userId);
        existing.setSourceEventId(event.getId());
        existing.setScreenRecordingUrl("https://cdn.example.com/old.mp4");

        EventUpdateRequest request = new EventUpdateRequest();
        request.setRecordingUrl("https://cdn.example.com/new.mp4");
        request.setAudioUrl("https://cdn.example.com/voice.m4a");
        when(eventRepository.findByIdForUpdate(event.getId())).thenReturn(Optional.of(event));
        when(eventRepository.save(event)).thenReturn(event);
        when(ideaRepository.findFirstByUserIdAndSourceEventIdOrderByCreatedAtAsc(userId, event.getId()))
                .thenReturn(Optional.of(existing));

        // Act
        eventService.update(userId, event.getId(), request);

        // Assert
        verify(ideaRepository).save(existing);
        assertEquals("https://cdn.example.com/new.mp4", existing.getScreenRecordingUrl());
        assertEquals("https://cdn.example.com/voice.m4a", existing.getAudioUrl());
    }

    @Test
    @DisplayName("update of an event without a screen recording should not create ideas")
    void testUpdate_NoRecordingNoPlaceholder() {
        // Arrange
        Event event = storedEvent();
        EventUpdateRequest request = new EventUpdateRequest();
        request.setAudioUrl("https://cdn.example.com/voice.m4a");
        when(eventRepository.findByIdForUpdate(event.getId())).thenReturn(Optional.of(event));
        when(eventRepository.save(event)).thenReturn(event);

        // Act
        eventService.update(userId, event.getId(), request);

        // Assert
        verifyNoInteractions(ideaRepository);
    }

    @Test
    @DisplayName("getLinkedIdea should be hidden while diagnostics are disabled")
    void testGetLinkedIdea_Disabled() {
        // Act & Assert
        assertThrows(ResourceNotFoundException.class, () -> eventService.getLinkedIdea(userId, UUID.randomUUID()));
        verifyNoInteractions(eventRepository, ideaRepository);
    }

    @Test
    @DisplayName("getLinkedIdea should flag an unfilled idea as a placeholder")
    void testGetLinkedIdea_Placeholder() {
        // Arrange
        properties.setDebugEnabled(true);
        Event event = storedEvent();
        EggbookIdea idea = new EggbookIdea();
        idea.setId(UUID.randomUUID());
        idea.setScreenRecordingUrl("https://cdn.example.com/screen.mp4");
        when(eventRepository.findByIdAndUserId(event.getId(), userId)).thenReturn(Optional.of(event));
        when(ideaRepository.findFirstByUserIdAndSourceEventIdOrderByCreatedAtAsc(userId, event.getId()))
                .thenReturn(Optional.of(idea));

        // Act
        LinkedIdeaResponse response = eventService.getLinkedIdea(userId, event.getId());

        // Assert
        assertEquals(event.getId(), response.getEventId());
        assertEquals(idea.getId(), response.getIdea().getId());
        assertTrue(response.getIdea().isPlaceholder());
        assertEquals("https://cdn.example.com/screen.mp4", response.getIdea().getScreenRecordingUrl());
    }

    @Test
    @DisplayName("getLinkedIdea should return a null idea when none is linked")
    void testGetLinkedIdea_None() {
        // Arrange
        properties.setDebugEnabled(true);
        Event event = storedEvent();
        when(eventRepository.findByIdAndUserId(event.getId(), userId)).thenReturn(Optional.of(event));
        when(ideaRepository.findFirstByUserIdAndSourceEventIdOrderByCreatedAtAsc(userId, event.getId()))
                .thenReturn(Optional.empty());

        // Act
        LinkedIdeaResponse response = eventService.getLinkedIdea(userId, event.getId());

        // Assert
        assertEquals(event.getId(), response.getEventId());
        assertNull(response.getIdea());
    }
}
