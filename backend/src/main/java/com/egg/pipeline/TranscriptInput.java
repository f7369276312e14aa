package com.egg.pipeline;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One event's text as handed to the extraction model.
 */
public record TranscriptInput(UUID eventId, LocalDateTime eventAt, String transcript) {
}
