package com.egg.repository;

import com.egg.entity.Memory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * Repository interface for Memory entity operations.
 */
@Repository
public interface MemoryRepository extends JpaRepository<Memory, UUID> {

    long countByUserId(UUID userId);
}
