package com.egg.pipeline;

/**
 * What the scheduler does with an event after it was created or updated.
 */
public enum TriggerPath {

    /** Nothing to do: processed, or no usable input. */
    NONE,

    /** Audio but no transcript yet: transcribe now, then classify again. */
    TRANSCRIPTION,

    /** Screen recording present: run extraction for this event alone. */
    SINGLE_INFERENCE,

    /** Transcript present, no recording: wait in the user's batch window. */
    BATCH_INFERENCE
}
