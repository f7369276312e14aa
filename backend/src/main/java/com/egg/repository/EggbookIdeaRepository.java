package com.egg.repository;

import com.egg.entity.EggbookIdea;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for EggbookIdea entity operations.
 */
@Repository
public interface EggbookIdeaRepository extends JpaRepository<EggbookIdea, UUID> {

    List<EggbookIdea> findByUserIdOrderByCreatedAtDesc(UUID userId);

    Optional<EggbookIdea> findByIdAndUserId(UUID id, UUID userId);

    List<EggbookIdea> findBySourceEventId(UUID sourceEventId);

    Optional<EggbookIdea> findFirstByUserIdAndSourceEventIdOrderByCreatedAtAsc(UUID userId, UUID sourceEventId);

    /**
     * Placeholder ideas (no title and no content yet) still waiting on the pipeline.
     */
    @Query("SELECT COUNT(i) FROM EggbookIdea i WHERE i.userId = :userId"
            + " AND (i.title IS NULL OR i.title = '') AND (i.content IS NULL OR i.content = '')")
    long countPlaceholders(@Param("userId") UUID userId);

    long countByUserId(UUID userId);

    /**
     * Ideas created in [start, end), used as daily comment signals.
     */
    @Query("SELECT i FROM EggbookIdea i WHERE i.userId = :userId AND i.createdAt >= :start AND i.createdAt < :end")
    List<EggbookIdea> findCreatedBetween(@Param("userId") UUID userId,
                                         @Param("start") LocalDateTime start,
                                         @Param("end") LocalDateTime end);
}
