package com.egg.controller;

import com.egg.dto.request.IdeaCreateRequest;
import com.egg.dto.response.IdeaResponse;
import com.egg.dto.response.ItemResponse;
import com.egg.dto.response.ItemsResponse;
import com.egg.dto.response.MessageResponse;
import com.egg.security.AuthenticatedUser;
import com.egg.service.EggbookService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/v1/eggbook/ideas")
@RequiredArgsConstructor
@Slf4j
public class IdeaController {

    private final EggbookService eggbookService;

    @GetMapping
    public ResponseEntity<ItemsResponse<IdeaResponse>> list(Authentication authentication) {
        return ResponseEntity.ok(new ItemsResponse<>(eggbookService.listIdeas(AuthenticatedUser.id(authentication))));
    }

    @PostMapping
    public ResponseEntity<ItemResponse<IdeaResponse>> create(
            @Valid @RequestBody IdeaCreateRequest request,
            Authentication authentication) {
        return ResponseEntity.ok(new ItemResponse<>(
                eggbookService.createIdea(AuthenticatedUser.id(authentication), request)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ItemResponse<IdeaResponse>> get(@PathVariable UUID id, Authentication authentication) {
        return ResponseEntity.ok(new ItemResponse<>(eggbookService.getIdea(AuthenticatedUser.id(authentication), id)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<MessageResponse> delete(@PathVariable UUID id, Authentication authentication) {
        eggbookService.deleteIdea(AuthenticatedUser.id(authentication), id);
        return ResponseEntity.ok(new MessageResponse("Idea deleted"));
    }
}
