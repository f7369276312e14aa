package com.egg.controller;

import com.egg.dto.request.MemoryRequest;
import com.egg.dto.response.MessageResponse;
import com.egg.security.AuthenticatedUser;
import com.egg.service.MemoryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Client-side memories: {@code POST /v1/memory {type, content, importance}}.
 */
@RestController
@RequestMapping("/v1/memory")
@RequiredArgsConstructor
@Slf4j
public class MemoryController {

    private final MemoryService memoryService;

    @PostMapping
    public ResponseEntity<MessageResponse> save(
            @Valid @RequestBody MemoryRequest request,
            Authentication authentication) {

        log.debug("Memory save requested: type={}, userId={}", request.getType(), authentication.getName());
        memoryService.save(AuthenticatedUser.id(authentication), request);
        return ResponseEntity.ok(new MessageResponse("Memory saved"));
    }
}
