package com.egg.controller;

import com.egg.dto.request.ScheduleRequest;
import com.egg.dto.request.TodoCreateRequest;
import com.egg.dto.request.TodoUpdateRequest;
import com.egg.dto.response.ItemResponse;
import com.egg.dto.response.ItemsResponse;
import com.egg.dto.response.MessageResponse;
import com.egg.dto.response.NotificationResponse;
import com.egg.dto.response.TodoResponse;
import com.egg.security.AuthenticatedUser;
import com.egg.service.EggbookService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Todo CRUD plus accept (accept and pin) and schedule (create a notification).
 */
@RestController
@RequestMapping("/v1/eggbook/todos")
@RequiredArgsConstructor
@Slf4j
public class TodoController {

    private final EggbookService eggbookService;

    @GetMapping
    public ResponseEntity<ItemsResponse<TodoResponse>> list(Authentication authentication) {
        return ResponseEntity.ok(new ItemsResponse<>(eggbookService.listTodos(AuthenticatedUser.id(authentication))));
    }

    @PostMapping
    public ResponseEntity<ItemResponse<TodoResponse>> create(
            @Valid @RequestBody TodoCreateRequest request,
            Authentication authentication) {
        return ResponseEntity.ok(new ItemResponse<>(
                eggbookService.createTodo(AuthenticatedUser.id(authentication), request)));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<ItemResponse<TodoResponse>> update(
            @PathVariable UUID id,
            @RequestBody TodoUpdateRequest request,
            Authentication authentication) {
        return ResponseEntity.ok(new ItemResponse<>(
                eggbookService.updateTodo(AuthenticatedUser.id(authentication), id, request)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<MessageResponse> delete(@PathVariable UUID id, Authentication authentication) {
        eggbookService.deleteTodo(AuthenticatedUser.id(authentication), id);
        return ResponseEntity.ok(new MessageResponse("Todo deleted"));
    }

    @PostMapping("/{id}/accept")
    public ResponseEntity<ItemResponse<TodoResponse>> accept(@PathVariable UUID id, Authentication authentication) {
        log.info("Todo accepted: todoId={}, userId={}", id, authentication.getName());
        return ResponseEntity.ok(new ItemResponse<>(
                eggbookService.acceptTodo(AuthenticatedUser.id(authentication), id)));
    }

    @PostMapping("/{id}/schedule")
    public ResponseEntity<ItemResponse<NotificationResponse>> schedule(
            @PathVariable UUID id,
            @Valid @RequestBody ScheduleRequest request,
            Authentication authentication) {
        return ResponseEntity.ok(new ItemResponse<>(
                eggbookService.scheduleTodo(AuthenticatedUser.id(authentication), id, request)));
    }
}
