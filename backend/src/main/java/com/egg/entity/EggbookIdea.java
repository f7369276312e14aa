package com.egg.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * An idea surfaced from the user's events (or typed in manually).
 *
 * Ideas created by the pipeline always carry the id of the event they were
 * extracted from in {@code sourceEventId}. The reference is informational only;
 * deleting an event never cascades here.
 *
 * An idea with neither title nor content is a placeholder: it is created when a
 * screen recording is attached to an event and filled in once the pipeline
 * extracts an idea from that event.
 *
 * Database Table: eggbook_ideas
 */
@Entity
@Table(name = "eggbook_ideas", indexes = {
    @Index(name = "idx_idea_user_created", columnList = "user_id, created_at"),
    @Index(name = "idx_idea_source_event", columnList = "source_event_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EggbookIdea {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "source_event_id")
    private UUID sourceEventId;

    @Column(name = "title", length = 500)
    private String title;

    @Column(name = "content", columnDefinition = "TEXT")
    private String content;

    @Column(name = "screen_recording_url", length = 2048)
    private String screenRecordingUrl;

    @Column(name = "recording_url", length = 2048)
    private String recordingUrl;

    @Column(name = "audio_url", length = 2048)
    private String audioUrl;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public boolean isPlaceholder() {
        return (title == null || title.isBlank()) && (content == null || content.isBlank());
    }
}
