package com.egg.messaging;

import java.util.UUID;

/**
 * Message published to the pipeline queue.
 *
 * @param type what the consumer should do
 * @param userId owner of the work
 * @param eventId event to transcribe, null for RUN_USER
 */
public record PipelineCommand(Type type, UUID userId, UUID eventId) {

    public enum Type {
        /** Transcribe one audio-only event, then re-classify it. */
        TRANSCRIBE,
        /** Run the user's ready work (single recording event or flushable batch). */
        RUN_USER
    }

    public static PipelineCommand transcribe(UUID userId, UUID eventId) {
        return new PipelineCommand(Type.TRANSCRIBE, userId, eventId);
    }

    public static PipelineCommand runUser(UUID userId) {
        return new PipelineCommand(Type.RUN_USER, userId, null);
    }
}
