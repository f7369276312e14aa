package com.egg.entity;

import com.fasterxml.jackson.annotation.JsonValue;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.UUID;

/**
 * Daily comment generation state, one row per (user, date).
 *
 * Status lifecycle:
 * - IDLE: nothing generated (no input, below the auto threshold, or no signals)
 * - GENERATING: model call in flight
 * - READY: comments stored and the "comments ready" notification sent
 * - FAILED: model call failed, errorMessage holds the cause
 *
 * Database Table: eggbook_comment_generations
 */
@Entity
@Table(name = "eggbook_comment_generations",
        uniqueConstraints = @UniqueConstraint(name = "uk_comment_generation_user_date", columnNames = {"user_id", "date"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CommentGeneration {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "date", nullable = false)
    private LocalDate date;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private GenerationStatus status = GenerationStatus.IDLE;

    @Column(name = "has_input", nullable = false)
    private boolean hasInput = false;

    @Column(name = "active_duration_sec", nullable = false)
    private double activeDurationSec = 0d;

    @Column(name = "trigger_mode", length = 16)
    private String triggerMode;

    @Column(name = "error_message", length = 500)
    private String errorMessage;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public CommentGeneration(UUID userId, LocalDate date) {
        this.userId = userId;
        this.date = date;
    }

    public enum GenerationStatus {
        IDLE,
        GENERATING,
        READY,
        FAILED;

        @JsonValue
        public String value() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
