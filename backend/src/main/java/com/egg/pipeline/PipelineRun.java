package com.egg.pipeline;

import java.util.List;
import java.util.UUID;

/**
 * One unit of work for the orchestrator: a single event, or a drained batch of events
 * belonging to one user.
 */
public record PipelineRun(UUID userId, InferenceMode mode, List<UUID> eventIds) {

    public PipelineRun {
        eventIds = List.copyOf(eventIds);
    }

    public static PipelineRun single(UUID userId, UUID eventId) {
        return new PipelineRun(userId, InferenceMode.SINGLE, List.of(eventId));
    }

    public static PipelineRun batch(UUID userId, List<UUID> eventIds) {
        return new PipelineRun(userId, InferenceMode.BATCH, eventIds);
    }
}
