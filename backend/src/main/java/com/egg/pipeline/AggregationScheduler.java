package com.egg.pipeline;

import com.egg.config.PipelineProperties;
import com.egg.entity.Event;
import com.egg.entity.Event.EventStatus;
import com.egg.messaging.PipelineCommand;
import com.egg.messaging.PipelineDispatchProducer;
import com.egg.repository.EventRepository;
import com.egg.service.DailyCommentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Decides when and how events reach the inference pipeline.
 *
 * Classification precedence (first match wins):
 * 1. processed                         → NONE
 * 2. screen recording (or legacy alias) → SINGLE_INFERENCE
 * 3. no transcript, audio present       → TRANSCRIPTION
 * 4. transcript present                 → BATCH_INFERENCE
 * 5. anything else                      → NONE
 *
 * Events with a recording never enter a batch window. Audio-only events are transcribed
 * first and then re-classified, which makes them batch-eligible.
 *
 * Runs are serialized per user by the {@link CooldownGate}. A denied run is deferred, not
 * dropped: its events stay pending and {@link PipelineSweeper} retries them.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AggregationScheduler {

    private final EventRepository eventRepository;
    private final BatchWindowRegistry windows;
    private final CooldownGate cooldownGate;
    private final PipelineOrchestrator orchestrator;
    private final PipelineDispatchProducer dispatchProducer;
    private final DailyCommentService dailyCommentService;
    private final PipelineProperties properties;

    /**
     * Pure classification of an event. No I/O.
     */
    public TriggerPath classify(Event event) {
        if (event.isProcessed()) {
            return TriggerPath.NONE;
        }
        if (event.hasScreenRecording()) {
            return TriggerPath.SINGLE_INFERENCE;
        }
        if (!event.hasTranscript() && event.hasAudio()) {
            return TriggerPath.TRANSCRIPTION;
        }
        if (event.hasTranscript()) {
            return TriggerPath.BATCH_INFERENCE;
        }
        return TriggerPath.NONE;
    }

    /**
     * React to a created or updated event: update the user's batch window and dispatch
     * whatever work the event makes ready. Only pending events are scheduled.
     *
     * @param event the saved event
     * @return the path the event was classified into
     */
    public TriggerPath onEventChanged(Event event) {
        UUID userId = event.getUserId();
        UUID eventId = event.getId();

        if (event.getStatus() != EventStatus.PENDING) {
            windows.remove(userId, eventId);
            log.debug("Event not pending, not scheduled: eventId={}, status={}", eventId, event.getStatus());
            return TriggerPath.NONE;
        }

        TriggerPath path = classify(event);
        log.info("Event classified: eventId={}, userId={}, path={}", eventId, userId, path);

        switch (path) {
            case BATCH_INFERENCE -> {
                windows.offer(userId, eventId, event.getEventAt());
                if (windows.shouldFlush(userId)) {
                    dispatch(PipelineCommand.runUser(userId));
                }
            }
            case SINGLE_INFERENCE -> {
                windows.remove(userId, eventId);
                dispatch(PipelineCommand.runUser(userId));
            }
            case TRANSCRIPTION -> {
                windows.remove(userId, eventId);
                dispatch(PipelineCommand.transcribe(userId, eventId));
            }
            case NONE -> windows.remove(userId, eventId);
        }
        return path;
    }

    /**
     * Produce a transcript for an audio-only event, then schedule it again.
     *
     * @param eventId the event to transcribe
     */
    public void transcribeAndReclassify(UUID eventId) {
        boolean stored = orchestrator.transcribeEvent(eventId);
        if (!stored) {
            return;
        }
        eventRepository.findById(eventId).ifPresent(this::onEventChanged);
    }

    /**
     * Run one unit of ready work for the user, if the gate allows it.
     *
     * Plan: the earliest pending recording event as a single run, otherwise a flushable
     * batch window drained up to AI_QUEUE_MAX_EVENTS_PER_RUN events. Anything left over
     * waits for the next dispatch or sweep.
     *
     * @param userId the user
     * @return the run result, {@link PipelineResult#deferredRun()} if the gate denied,
     *         {@link PipelineResult#empty()} if nothing was ready
     */
    public PipelineResult runForUser(UUID userId) {
        if (!hasReadyWork(userId)) {
            log.debug("No ready work: userId={}", userId);
            return PipelineResult.empty();
        }

        if (!cooldownGate.tryAcquire(userId)) {
            log.info("Pipeline run deferred by cooldown gate: userId={}", userId);
            return PipelineResult.deferredRun();
        }

        try {
            PipelineRun run = planRun(userId);
            if (run == null) {
                return PipelineResult.empty();
            }

            PipelineResult result = orchestrator.execute(run);

            if (result.hasProcessed()) {
                try {
                    dailyCommentService.triggerAuto(userId);
                } catch (RuntimeException e) {
                    log.warn("Automatic comment generation failed: userId={}, error={}", userId, e.getMessage());
                }
            }
            return result;

        } finally {
            cooldownGate.release(userId);
        }
    }

    /**
     * Whether the user has a pending recording event or a flushable batch window.
     */
    public boolean hasReadyWork(UUID userId) {
        return !eventRepository.findPendingSingleCandidates(userId).isEmpty() || windows.shouldFlush(userId);
    }

    private PipelineRun planRun(UUID userId) {
        List<Event> singles = eventRepository.findPendingSingleCandidates(userId);
        if (!singles.isEmpty()) {
            Event first = singles.get(0);
            windows.remove(userId, first.getId());
            return PipelineRun.single(userId, first.getId());
        }

        if (!windows.shouldFlush(userId)) {
            return null;
        }
        List<UUID> drained = windows.drain(userId, properties.getMaxEventsPerRun());
        return drained.isEmpty() ? null : PipelineRun.batch(userId, drained);
    }

    private void dispatch(PipelineCommand command) {
        try {
            dispatchProducer.send(command);
        } catch (AmqpException e) {
            log.warn("Dispatch failed, work left for the sweep: type={}, userId={}, error={}",
                    command.type(), command.userId(), e.getMessage());
        }
    }
}
