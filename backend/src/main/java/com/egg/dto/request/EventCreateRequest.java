package com.egg.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Event ingestion payload.
 *
 * {@code recording_url} is the deprecated name of {@code screen_recording_url};
 * when both are sent, {@code screen_recording_url} wins.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EventCreateRequest {

    @NotBlank(message = "device_id is required")
    @JsonProperty("device_id")
    private String deviceId;

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

    /** UTC; defaults to now. */
    @JsonProperty("event_at")
    private LocalDateTime eventAt;
}
