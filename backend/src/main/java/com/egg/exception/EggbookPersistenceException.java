package com.egg.exception;

import java.util.UUID;

/**
 * Exception thrown when extracted entries cannot be written for an event.
 * The event is marked FAILED; other events of the same run are unaffected.
 */
public class EggbookPersistenceException extends PipelineException {

    public EggbookPersistenceException(String errorCode, String message, Throwable cause) {
        super("persistence", errorCode, false, message, cause);
    }

    public static EggbookPersistenceException writeFailed(UUID eventId, Throwable cause) {
        return new EggbookPersistenceException(
                "WRITE_FAILED",
                String.format("Failed to store eggbook entries for event '%s': %s", eventId, cause.getMessage()),
                cause
        );
    }
}
