package com.egg.messaging;

import com.egg.pipeline.AggregationScheduler;
import com.egg.pipeline.PipelineResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

/**
 * Consumer for pipeline commands.
 *
 * Runs on the listener container's threads, so pipeline work never blocks an HTTP request
 * and survives the client disconnecting. Concurrency across users is governed by the
 * listener concurrency settings; per user, the cooldown gate serializes runs.
 *
 * Error Handling:
 * - Malformed command: logged and dropped (retrying cannot fix it)
 * - Pipeline failures: already recorded on event status by the orchestrator
 * - Unexpected errors (database down): re-thrown, so the message goes to the DLQ.
 *   The sweep re-dispatches the work later.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PipelineDispatchConsumer {

    private final AggregationScheduler aggregationScheduler;

    @RabbitListener(queues = "${app.rabbitmq.queue.pipeline:egg.pipeline.queue}")
    public void onCommand(PipelineCommand command) {
        if (command == null || command.type() == null || command.userId() == null) {
            log.error("Dropping malformed pipeline command: command={}", command);
            return;
        }

        MDC.put("userId", command.userId().toString());
        log.info("Received pipeline command: type={}, userId={}, eventId={}",
                command.type(), command.userId(), command.eventId());

        try {
            switch (command.type()) {
                case TRANSCRIBE -> {
                    if (command.eventId() == null) {
                        log.error("Dropping TRANSCRIBE command without event: userId={}", command.userId());
                        return;
                    }
                    aggregationScheduler.transcribeAndReclassify(command.eventId());
                }
                case RUN_USER -> {
                    PipelineResult result = aggregationScheduler.runForUser(command.userId());
                    if (result.deferred()) {
                        log.debug("Run deferred by cooldown gate: userId={}", command.userId());
                    }
                }
            }
        } catch (RuntimeException e) {
            log.error("Unexpected error handling pipeline command: type={}, userId={}, error={}",
                    command.type(), command.userId(), e.getMessage(), e);
            throw e;
        } finally {
            MDC.remove("userId");
        }
    }
}
