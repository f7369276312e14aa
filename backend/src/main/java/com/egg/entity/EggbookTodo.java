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
 * A suggested or accepted action item.
 *
 * Pipeline todos start unaccepted and unpinned; accepting a todo pins it.
 *
 * Database Table: eggbook_todos
 */
@Entity
@Table(name = "eggbook_todos", indexes = {
    @Index(name = "idx_todo_user_created", columnList = "user_id, created_at"),
    @Index(name = "idx_todo_source_event", columnList = "source_event_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EggbookTodo {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "source_event_id")
    private UUID sourceEventId;

    @Column(name = "title", nullable = false, length = 500)
    private String title;

    @Column(name = "is_accepted", nullable = false)
    private boolean accepted = false;

    @Column(name = "is_pinned", nullable = false)
    private boolean pinned = false;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
