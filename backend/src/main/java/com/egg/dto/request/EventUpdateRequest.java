package com.egg.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Partial event update. Null fields are left unchanged.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EventUpdateRequest {

    @JsonProperty("audio_url")
    private String audioUrl;

    @JsonProperty("screen_recording_url")
    private String screenRecordingUrl;

    @JsonProperty("recording_url")
    private String recordingUrl;

    private String transcript;

    @PositiveOrZero(message = "duration_sec must not be negative")
    @JsonProperty("duration_sec")
    private Double durationSec;

    @JsonProperty("event_at")
    private LocalDateTime eventAt;

    /** One of pending, transcribing, processed, failed. Without it the event goes back to pending. */
    private String status;
}
