package com.egg.entity;

import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Event entity: one ingestion from the app (a voice note, a screen recording or a typed transcript).
 *
 * Status lifecycle: PENDING → TRANSCRIBING → PROCESSED/FAILED. A client update puts the
 * event back to PENDING so it can be reprocessed. The pipeline never deletes events.
 *
 * The screen recording reference is stored twice: {@code screen_recording_url} and the legacy
 * {@code recording_url} column that older clients still read. Both are kept in sync through
 * {@link #setScreenRecordingReference(String)}.
 *
 * Database Table: events
 */
@Entity
@Table(name = "events", indexes = {
    @Index(name = "idx_event_user_status", columnList = "user_id, status"),
    @Index(name = "idx_event_event_at", columnList = "event_at"),
    @Index(name = "idx_event_updated_at", columnList = "updated_at")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Event {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "device_id", nullable = false, length = 128)
    private String deviceId;

    @Column(name = "audio_url", length = 2048)
    private String audioUrl;

    @Column(name = "screen_recording_url", length = 2048)
    private String screenRecordingUrl;

    /**
     * Deprecated alias of screenRecordingUrl, kept for backward compatibility.
     */
    @Column(name = "recording_url", length = 2048)
    private String recordingUrl;

    @Column(name = "transcript", columnDefinition = "TEXT")
    private String transcript;

    @Column(name = "duration_sec")
    private Double durationSec = 0d;

    @Column(name = "event_at", nullable = false)
    private LocalDateTime eventAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private EventStatus status = EventStatus.PENDING;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * Event processing status as exposed to clients (lower-case on the wire).
     */
    public enum EventStatus {
        PENDING,
        TRANSCRIBING,
        PROCESSED,
        FAILED;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }

        /**
         * Parse a client-supplied status value.
         *
         * @param value lower- or upper-case status name
         * @return the matching status
         * @throws IllegalArgumentException if the value is not one of the four statuses
         */
        public static EventStatus fromValue(String value) {
            if (value != null) {
                for (EventStatus status : values()) {
                    if (status.name().equalsIgnoreCase(value.trim())) {
                        return status;
                    }
                }
            }
            throw new IllegalArgumentException("Invalid status");
        }
    }

    /**
     * Statuses the pipeline is allowed to (re)process.
     */
    public static final List<EventStatus> RUNNABLE_STATUSES =
            List.of(EventStatus.PENDING, EventStatus.TRANSCRIBING, EventStatus.FAILED);

    /**
     * The screen recording reference, falling back to the legacy alias.
     */
    public String screenRecordingReference() {
        if (hasText(screenRecordingUrl)) {
            return screenRecordingUrl.trim();
        }
        return hasText(recordingUrl) ? recordingUrl.trim() : null;
    }

    /**
     * Set the screen recording reference on both the current and the legacy column.
     */
    public void setScreenRecordingReference(String url) {
        this.screenRecordingUrl = url;
        this.recordingUrl = url;
    }

    public boolean hasScreenRecording() {
        return screenRecordingReference() != null;
    }

    public boolean hasAudio() {
        return hasText(audioUrl);
    }

    public boolean hasTranscript() {
        return hasText(transcript);
    }

    public boolean isProcessed() {
        return status == EventStatus.PROCESSED;
    }

    /**
     * Media references usable for speech-to-text, in the order they should be tried:
     * audio, then screen recording, then the legacy recording column. Duplicates are dropped.
     */
    public List<String> transcriptionSources() {
        List<String> sources = new ArrayList<>(3);
        for (String candidate : new String[]{audioUrl, screenRecordingUrl, recordingUrl}) {
            if (hasText(candidate) && !sources.contains(candidate.trim())) {
                sources.add(candidate.trim());
            }
        }
        return sources;
    }

    private static boolean hasText(String value) {
        return value != null && !value.trim().isEmpty();
    }
}
