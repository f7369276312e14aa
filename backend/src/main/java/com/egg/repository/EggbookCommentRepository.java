package com.egg.repository;

import com.egg.entity.EggbookComment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Repository interface for EggbookComment entity operations.
 */
@Repository
public interface EggbookCommentRepository extends JpaRepository<EggbookComment, UUID> {

    /**
     * Comments dated in [start, end), newest first.
     */
    @Query("SELECT c FROM EggbookComment c WHERE c.userId = :userId AND c.date >= :start AND c.date < :end " +
           "ORDER BY c.createdAt DESC")
    List<EggbookComment> findInDateRange(@Param("userId") UUID userId,
                                         @Param("start") LocalDate start,
                                         @Param("end") LocalDate end);

    /**
     * Duplicate check for generated comments. Null egg fields match NULL columns.
     */
    boolean existsByUserIdAndDateAndCommunityAndContentAndEggNameAndEggComment(
            UUID userId, LocalDate date, boolean community, String content, String eggName, String eggComment);

    List<EggbookComment> findBySourceEventId(UUID sourceEventId);

    @Modifying
    @Transactional
    @Query("DELETE FROM EggbookComment c WHERE c.userId = :userId AND c.date < :cutoff")
    int deleteOlderThan(@Param("userId") UUID userId, @Param("cutoff") LocalDate cutoff);
}
