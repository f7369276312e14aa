package com.egg.exception;

/**
 * Base exception for failures inside the aggregation and inference pipeline.
 *
 * Pipeline exceptions never reach an HTTP caller: the orchestrator catches them and
 * turns them into event status FAILED (or retries them when {@link #isTransient()}).
 * They carry the stage where processing failed and an error code for log correlation.
 *
 * Stages used:
 * - transcription: speech-to-text over an event's media
 * - extraction: the generative model call and its JSON parsing
 * - persistence: writing eggbook entries and the final event status
 *
 * @see TranscriptionException
 * @see ExtractionException
 * @see EggbookPersistenceException
 */
public class PipelineException extends RuntimeException {

    private final String processingStage;
    private final String errorCode;
    private final boolean transientFailure;

    /**
     * Constructs a new PipelineException with stage, error code, transient flag, message, and cause.
     *
     * @param processingStage the stage where processing failed
     * @param errorCode the error code for categorization (e.g., "RATE_LIMITED", "INVALID_JSON")
     * @param transientFailure whether retrying the same call may succeed
     * @param message the detail message
     * @param cause the cause of the exception
     */
    public PipelineException(String processingStage, String errorCode, boolean transientFailure,
                             String message, Throwable cause) {
        super(message, cause);
        this.processingStage = processingStage;
        this.errorCode = errorCode;
        this.transientFailure = transientFailure;
    }

    public String getProcessingStage() {
        return processingStage;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Whether the failure is worth retrying (rate limit, 5xx, timeout).
     *
     * @return true for transient failures, false for permanent ones
     */
    public boolean isTransient() {
        return transientFailure;
    }
}
