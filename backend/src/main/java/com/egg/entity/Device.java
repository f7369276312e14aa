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
 * A client device linked to exactly one user.
 *
 * The primary key is supplied by the app (a stable install identifier), so a device
 * can be re-registered idempotently. Events must reference a device owned by the
 * posting user.
 *
 * Database Table: devices
 */
@Entity
@Table(name = "devices", indexes = {
    @Index(name = "idx_device_user_id", columnList = "user_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Device {

    @Id
    @Column(name = "id", updatable = false, nullable = false, length = 128)
    private String id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "device_model", length = 128)
    private String deviceModel;

    @Column(name = "os", length = 64)
    private String os;

    @Column(name = "language", length = 32)
    private String language;

    @Column(name = "timezone", length = 64)
    private String timezone;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
