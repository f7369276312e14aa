package com.egg.pipeline;

import com.egg.config.PipelineProperties;
import com.egg.entity.Event;
import com.egg.entity.Event.EventStatus;
import com.egg.messaging.PipelineCommand;
import com.egg.messaging.PipelineDispatchProducer;
import com.egg.repository.EventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Periodic recovery pass for the pipeline.
 *
 * Each pass:
 * 1. Requeues events stuck in TRANSCRIBING longer than the grace period (crashed run) as PENDING
 * 2. Re-dispatches transcription for pending audio-only events
 * 3. Re-offers pending batch-eligible events to the windows (rebuilds them after a restart)
 * 4. Dispatches a run for every user with ready work, which also picks up runs the
 *    cooldown gate deferred
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PipelineSweeper {

    private final EventRepository eventRepository;
    private final BatchWindowRegistry windows;
    private final AggregationScheduler aggregationScheduler;
    private final PipelineDispatchProducer dispatchProducer;
    private final PipelineProperties properties;
    private final Clock clock;

    @Scheduled(
            fixedDelayString = "${app.pipeline.sweep-interval-ms:60000}",
            initialDelayString = "${app.pipeline.sweep-interval-ms:60000}"
    )
    public void sweep() {
        try {
            SweepReport report = sweepOnce();
            if (report.hasActivity()) {
                log.info("Pipeline sweep: requeued={}, transcriptions={}, reoffered={}, runs={}",
                        report.requeued(), report.transcriptions(), report.reoffered(), report.runs());
            }
        } catch (RuntimeException e) {
            log.error("Pipeline sweep failed: error={}", e.getMessage(), e);
        }
    }

    /**
     * One recovery pass.
     */
    public SweepReport sweepOnce() {
        LocalDateTime now = LocalDateTime.now(clock);

        int requeued = 0;
        LocalDateTime threshold = now.minus(properties.transcribingGrace());
        for (Event stuck : eventRepository.findStuckTranscribing(threshold)) {
            int moved = eventRepository.compareAndSetStatus(
                    stuck.getId(), List.of(EventStatus.TRANSCRIBING), EventStatus.PENDING, now);
            if (moved == 1) {
                log.warn("Requeued stuck event: eventId={}, userId={}, lastUpdate={}",
                        stuck.getId(), stuck.getUserId(), stuck.getUpdatedAt());
                requeued++;
            }
        }

        int transcriptions = 0;
        for (Event awaiting : eventRepository.findPendingAwaitingTranscription()) {
            if (dispatch(PipelineCommand.transcribe(awaiting.getUserId(), awaiting.getId()))) {
                transcriptions++;
            }
        }

        Set<UUID> users = new LinkedHashSet<>(eventRepository.findUserIdsWithStatus(EventStatus.PENDING));
        users.addAll(windows.users());

        int reoffered = 0;
        int runs = 0;
        for (UUID userId : users) {
            for (Event batchable : eventRepository.listPendingBatchable(userId)) {
                if (!windows.contains(userId, batchable.getId())) {
                    reoffered++;
                }
                windows.offer(userId, batchable.getId(), batchable.getEventAt());
            }
            if (aggregationScheduler.hasReadyWork(userId) && dispatch(PipelineCommand.runUser(userId))) {
                runs++;
            }
        }

        return new SweepReport(requeued, transcriptions, reoffered, runs);
    }

    private boolean dispatch(PipelineCommand command) {
        try {
            dispatchProducer.send(command);
            return true;
        } catch (AmqpException e) {
            log.warn("Sweep dispatch failed: type={}, userId={}, error={}",
                    command.type(), command.userId(), e.getMessage());
            return false;
        }
    }

    public record SweepReport(int requeued, int transcriptions, int reoffered, int runs) {

        boolean hasActivity() {
            return requeued + transcriptions + reoffered + runs > 0;
        }
    }
}
