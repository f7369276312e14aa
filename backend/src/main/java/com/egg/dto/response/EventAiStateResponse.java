package com.egg.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Diagnostic view of why an event has or has not been processed yet.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventAiStateResponse {

    private UUID eventId;

    private UUID userId;

    private String status;

    private LocalDateTime eventAt;

    private LocalDateTime updatedAt;

    /** NONE, TRANSCRIPTION, SINGLE_INFERENCE or BATCH_INFERENCE */
    private String triggerPath;

    private Signals signals;

    private BatchWindow batchWindow;

    private GateState runtime;

    private String probableReason;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Signals {
        private boolean hasAudioUrl;
        private boolean hasScreenRecordingUrl;
        private boolean hasTranscript;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BatchWindow {
        private boolean queued;
        private int size;
        private int triggerCount;
        private double maxWaitHours;
        private LocalDateTime oldestEventAt;
        private boolean countReached;
        private boolean waitExceeded;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GateState {
        private boolean userProcessing;
        private long cooldownRemainingSec;
        private long pendingEvents;
    }
}
