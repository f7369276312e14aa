package com.egg.service;

import com.egg.dto.request.MemoryRequest;
import com.egg.entity.Memory;
import com.egg.repository.MemoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Service
@Slf4j
@RequiredArgsConstructor
public class MemoryService {

    private final MemoryRepository memoryRepository;

    /**
     * Store a memory for the user.
     *
     * @throws IllegalArgumentException if importance is not a finite number
     */
    @Transactional
    public void save(UUID userId, MemoryRequest request) {
        if (!Double.isFinite(request.getImportance())) {
            throw new IllegalArgumentException("importance must be a finite number");
        }

        Memory memory = new Memory();
        memory.setUserId(userId);
        memory.setType(request.getType().trim());
        memory.setContent(request.getContent());
        memory.setImportance(request.getImportance());

        Memory saved = memoryRepository.save(memory);
        log.info("Memory saved: memoryId={}, userId={}, type={}", saved.getId(), userId, saved.getType());
    }
}
