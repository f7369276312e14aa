package com.egg.exception;

/**
 * Exception thrown when speech-to-text fails for an event's media.
 *
 * A transcription failure only ever fails the event it belongs to; the rest of
 * a batch carries on.
 *
 * @see com.egg.service.WhisperTranscriptionService
 */
public class TranscriptionException extends PipelineException {

    private static final String STAGE = "transcription";

    public TranscriptionException(String errorCode, boolean transientFailure, String message, Throwable cause) {
        super(STAGE, errorCode, transientFailure, message, cause);
    }

    /**
     * The event has no audio, screen recording or legacy recording reference.
     *
     * @param eventId the event being transcribed
     * @return a permanent TranscriptionException
     */
    public static TranscriptionException noMediaSource(String eventId) {
        return new TranscriptionException(
                "NO_MEDIA_SOURCE",
                false,
                String.format("Event '%s' has no media to transcribe.", eventId),
                null
        );
    }

    /**
     * The media exceeds the configured size limit.
     *
     * @param mediaRef the media reference
     * @param sizeBytes actual size
     * @param maxBytes configured maximum
     * @return a permanent TranscriptionException
     */
    public static TranscriptionException mediaTooLarge(String mediaRef, long sizeBytes, long maxBytes) {
        return new TranscriptionException(
                "MEDIA_TOO_LARGE",
                false,
                String.format("Media '%s' is %d bytes, above the %d byte limit.", mediaRef, sizeBytes, maxBytes),
                null
        );
    }

    /**
     * The media reference is not a URL we can read.
     *
     * @param mediaRef the media reference
     * @param cause parse or I/O failure
     * @return a permanent TranscriptionException
     */
    public static TranscriptionException invalidMedia(String mediaRef, Throwable cause) {
        return new TranscriptionException(
                "INVALID_MEDIA",
                false,
                String.format("Media '%s' could not be read.", mediaRef),
                cause
        );
    }

    /**
     * The model returned no text.
     *
     * @param mediaRef the media reference
     * @return a permanent TranscriptionException
     */
    public static TranscriptionException emptyTranscription(String mediaRef) {
        return new TranscriptionException(
                "EMPTY_TRANSCRIPTION",
                false,
                String.format("Transcription of '%s' produced no text. The audio may be silent or contain no speech.", mediaRef),
                null
        );
    }

    /**
     * The speech-to-text call itself failed.
     *
     * @param mediaRef the media reference
     * @param transientFailure whether the provider error is retryable
     * @param cause the provider error
     * @return a TranscriptionException
     */
    public static TranscriptionException providerFailed(String mediaRef, boolean transientFailure, Throwable cause) {
        return new TranscriptionException(
                transientFailure ? "STT_UNAVAILABLE" : "STT_REJECTED",
                transientFailure,
                String.format("Speech-to-text failed for '%s': %s", mediaRef, cause.getMessage()),
                cause
        );
    }

    public static TranscriptionException retriesExhausted(int attempts, TranscriptionException last) {
        return new TranscriptionException(
                "STT_RETRIES_EXHAUSTED",
                false,
                String.format("Speech-to-text failed after %d attempts: %s", attempts, last.getMessage()),
                last
        );
    }
}
