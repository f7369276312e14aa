package com.egg.repository;

import com.egg.entity.Event;
import com.egg.entity.Event.EventStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for Event entity operations (the event store).
 *
 * Status transitions issued by the pipeline are bulk JPQL updates guarded by the
 * current status, so two workers can never both move the same event. Bulk updates
 * bypass {@code @UpdateTimestamp}; every one of them sets {@code updatedAt} itself.
 *
 * "Has a recording" means a non-blank screen_recording_url or recording_url.
 */
@Repository
public interface EventRepository extends JpaRepository<Event, UUID> {

    /**
     * Find an event owned by the given user.
     *
     * @param id the event ID
     * @param userId the owning user ID
     * @return Optional containing the event if it exists and belongs to the user
     */
    Optional<Event> findByIdAndUserId(UUID id, UUID userId);

    /**
     * Load an event with a pessimistic row lock. Must be called inside a transaction.
     *
     * @param id the event ID
     * @return Optional containing the locked event
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM Event e WHERE e.id = :id")
    Optional<Event> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Move an event to {@code target} only if its current status is one of {@code from}.
     *
     * @return 1 if the event was moved, 0 if another worker got there first
     */
    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE Event e SET e.status = :target, e.updatedAt = :now WHERE e.id = :id AND e.status IN :from")
    int compareAndSetStatus(@Param("id") UUID id,
                            @Param("from") Collection<EventStatus> from,
                            @Param("target") EventStatus target,
                            @Param("now") LocalDateTime now);

    /**
     * Claim an event for a pipeline run by moving it to TRANSCRIBING.
     * Processed events are never claimed, which keeps reruns idempotent.
     *
     * @param id the event ID
     * @param now current UTC time
     * @return true if this caller now owns the event
     */
    default boolean claim(UUID id, LocalDateTime now) {
        return compareAndSetStatus(id, Event.RUNNABLE_STATUSES, EventStatus.TRANSCRIBING, now) == 1;
    }

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE Event e SET e.status = :status, e.updatedAt = :now WHERE e.id IN :ids")
    int markStatus(@Param("ids") Collection<UUID> ids,
                   @Param("status") EventStatus status,
                   @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE Event e SET e.transcript = :transcript, e.updatedAt = :now WHERE e.id = :id")
    int updateTranscript(@Param("id") UUID id,
                         @Param("transcript") String transcript,
                         @Param("now") LocalDateTime now);

    /**
     * Pending events that carry a recording, oldest first. Candidates for single inference.
     */
    @Query("SELECT e FROM Event e WHERE e.userId = :userId AND e.status = :status " +
           "AND ((e.screenRecordingUrl IS NOT NULL AND TRIM(e.screenRecordingUrl) <> '') " +
           "OR (e.recordingUrl IS NOT NULL AND TRIM(e.recordingUrl) <> '')) " +
           "ORDER BY e.eventAt ASC")
    List<Event> findWithRecordingByUserIdAndStatus(@Param("userId") UUID userId,
                                                   @Param("status") EventStatus status);

    default List<Event> findPendingSingleCandidates(UUID userId) {
        return findWithRecordingByUserIdAndStatus(userId, EventStatus.PENDING);
    }

    /**
     * Events without a recording whose transcript is present, oldest first.
     */
    @Query("SELECT e FROM Event e WHERE e.userId = :userId AND e.status = :status " +
           "AND (e.screenRecordingUrl IS NULL OR TRIM(e.screenRecordingUrl) = '') " +
           "AND (e.recordingUrl IS NULL OR TRIM(e.recordingUrl) = '') " +
           "AND e.transcript IS NOT NULL AND TRIM(e.transcript) <> '' " +
           "ORDER BY e.eventAt ASC")
    List<Event> findBatchableByUserIdAndStatus(@Param("userId") UUID userId,
                                               @Param("status") EventStatus status);

    /**
     * Pending events eligible for batched inference.
     */
    default List<Event> listPendingBatchable(UUID userId) {
        return findBatchableByUserIdAndStatus(userId, EventStatus.PENDING);
    }

    /**
     * Pending events with audio but neither a transcript nor a recording.
     * They need a transcription pass before they can join a batch.
     */
    @Query("SELECT e FROM Event e WHERE e.status = :status " +
           "AND (e.screenRecordingUrl IS NULL OR TRIM(e.screenRecordingUrl) = '') " +
           "AND (e.recordingUrl IS NULL OR TRIM(e.recordingUrl) = '') " +
           "AND (e.transcript IS NULL OR TRIM(e.transcript) = '') " +
           "AND e.audioUrl IS NOT NULL AND TRIM(e.audioUrl) <> '' " +
           "ORDER BY e.eventAt ASC")
    List<Event> findAwaitingTranscriptionByStatus(@Param("status") EventStatus status);

    default List<Event> findPendingAwaitingTranscription() {
        return findAwaitingTranscriptionByStatus(EventStatus.PENDING);
    }

    /**
     * Events stuck in TRANSCRIBING since before the threshold (crashed or abandoned run).
     */
    @Query("SELECT e FROM Event e WHERE e.status = :status AND e.updatedAt < :threshold")
    List<Event> findByStatusUpdatedBefore(@Param("status") EventStatus status,
                                          @Param("threshold") LocalDateTime threshold);

    default List<Event> findStuckTranscribing(LocalDateTime threshold) {
        return findByStatusUpdatedBefore(EventStatus.TRANSCRIBING, threshold);
    }

    /**
     * Users that currently own at least one event in the given status.
     */
    @Query("SELECT DISTINCT e.userId FROM Event e WHERE e.status = :status")
    List<UUID> findUserIdsWithStatus(@Param("status") EventStatus status);

    long countByUserIdAndStatus(UUID userId, EventStatus status);

    long countByUserIdAndStatusIn(UUID userId, Collection<EventStatus> statuses);

    /**
     * Events whose event time falls in [start, end). Used for daily input statistics.
     */
    @Query("SELECT e FROM Event e WHERE e.userId = :userId AND e.eventAt >= :start AND e.eventAt < :end")
    List<Event> findByUserIdAndEventAtRange(@Param("userId") UUID userId,
                                            @Param("start") LocalDateTime start,
                                            @Param("end") LocalDateTime end);
}
