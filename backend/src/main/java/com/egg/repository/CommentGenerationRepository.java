package com.egg.repository;

import com.egg.entity.CommentGeneration;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for CommentGeneration entity operations.
 */
@Repository
public interface CommentGenerationRepository extends JpaRepository<CommentGeneration, UUID> {

    Optional<CommentGeneration> findByUserIdAndDate(UUID userId, LocalDate date);

    @Modifying
    @Transactional
    @Query("DELETE FROM CommentGeneration g WHERE g.userId = :userId AND g.date < :cutoff")
    int deleteOlderThan(@Param("userId") UUID userId, @Param("cutoff") LocalDate cutoff);
}
