package com.egg.repository;

import com.egg.entity.EggbookTodo;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for EggbookTodo entity operations.
 */
@Repository
public interface EggbookTodoRepository extends JpaRepository<EggbookTodo, UUID> {

    List<EggbookTodo> findByUserIdOrderByCreatedAtDesc(UUID userId);

    Optional<EggbookTodo> findByIdAndUserId(UUID id, UUID userId);

    List<EggbookTodo> findBySourceEventId(UUID sourceEventId);

    long countByUserId(UUID userId);

    @Query("SELECT t FROM EggbookTodo t WHERE t.userId = :userId AND t.createdAt >= :start AND t.createdAt < :end")
    List<EggbookTodo> findCreatedBetween(@Param("userId") UUID userId,
                                         @Param("start") LocalDateTime start,
                                         @Param("end") LocalDateTime end);
}
