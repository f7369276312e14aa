package com.egg.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Event as returned to clients. {@code recordingUrl} mirrors {@code screenRecordingUrl}
 * for older clients.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventResponse {

    private UUID eventId;

    private String deviceId;

    private String recordingUrl;

    private String audioUrl;

    private String screenRecordingUrl;

    private String transcript;

    private long durationSec;

    private LocalDateTime eventAt;

    private String status;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
