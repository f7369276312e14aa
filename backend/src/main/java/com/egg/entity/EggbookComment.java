package com.egg.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * A daily comment, either the user's own egg ({@code community = false}) or a
 * community persona ({@code eggName}/{@code eggComment} set).
 *
 * Comments older than the retention window are purged on read.
 *
 * Database Table: eggbook_comments
 */
@Entity
@Table(name = "eggbook_comments", indexes = {
    @Index(name = "idx_comment_user_date", columnList = "user_id, date")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EggbookComment {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "source_event_id")
    private UUID sourceEventId;

    @Column(name = "content", nullable = false, columnDefinition = "TEXT")
    private String content;

    @Column(name = "egg_name", length = 200)
    private String eggName;

    @Column(name = "egg_comment", columnDefinition = "TEXT")
    private String eggComment;

    @Column(name = "date", nullable = false)
    private LocalDate date;

    @Column(name = "is_community", nullable = false)
    private boolean community = false;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
