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
 * A reminder shown to the user at {@code notifyAt}.
 *
 * Also used for extracted alerts (notifyAt = extraction time) and for the
 * "comments ready" message of the daily comment generation.
 *
 * Database Table: eggbook_notifications
 */
@Entity
@Table(name = "eggbook_notifications", indexes = {
    @Index(name = "idx_notification_user_notify_at", columnList = "user_id, notify_at"),
    @Index(name = "idx_notification_source_event", columnList = "source_event_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EggbookNotification {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "source_event_id")
    private UUID sourceEventId;

    @Column(name = "todo_id")
    private UUID todoId;

    @Column(name = "title", nullable = false, length = 500)
    private String title;

    @Column(name = "notify_at", nullable = false)
    private LocalDateTime notifyAt;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
