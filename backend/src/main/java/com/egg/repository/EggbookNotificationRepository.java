package com.egg.repository;

import com.egg.entity.EggbookNotification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for EggbookNotification entity operations.
 */
@Repository
public interface EggbookNotificationRepository extends JpaRepository<EggbookNotification, UUID> {

    List<EggbookNotification> findByUserIdOrderByNotifyAtAsc(UUID userId);

    Optional<EggbookNotification> findByIdAndUserId(UUID id, UUID userId);

    List<EggbookNotification> findBySourceEventId(UUID sourceEventId);

    boolean existsByUserIdAndTitle(UUID userId, String title);

    long countByUserId(UUID userId);

    @Query("SELECT n FROM EggbookNotification n WHERE n.userId = :userId AND n.createdAt >= :start AND n.createdAt < :end")
    List<EggbookNotification> findCreatedBetween(@Param("userId") UUID userId,
                                                 @Param("start") LocalDateTime start,
                                                 @Param("end") LocalDateTime end);
}
