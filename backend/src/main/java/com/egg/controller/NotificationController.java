package com.egg.controller;

import com.egg.dto.request.NotificationCreateRequest;
import com.egg.dto.request.ScheduleRequest;
import com.egg.dto.response.ItemResponse;
import com.egg.dto.response.ItemsResponse;
import com.egg.dto.response.MessageResponse;
import com.egg.dto.response.NotificationResponse;
import com.egg.security.AuthenticatedUser;
import com.egg.service.EggbookService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/v1/eggbook/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final EggbookService eggbookService;

    @GetMapping
    public ResponseEntity<ItemsResponse<NotificationResponse>> list(Authentication authentication) {
        return ResponseEntity.ok(new ItemsResponse<>(
                eggbookService.listNotifications(AuthenticatedUser.id(authentication))));
    }

    @PostMapping
    public ResponseEntity<ItemResponse<NotificationResponse>> create(
            @Valid @RequestBody NotificationCreateRequest request,
            Authentication authentication) {
        return ResponseEntity.ok(new ItemResponse<>(
                eggbookService.createNotification(AuthenticatedUser.id(authentication), request)));
    }

    /**
     * Reschedule: only {@code notify_at} can change.
     */
    @PatchMapping("/{id}")
    public ResponseEntity<ItemResponse<NotificationResponse>> reschedule(
            @PathVariable UUID id,
            @Valid @RequestBody ScheduleRequest request,
            Authentication authentication) {
        return ResponseEntity.ok(new ItemResponse<>(
                eggbookService.rescheduleNotification(AuthenticatedUser.id(authentication), id, request)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<MessageResponse> delete(@PathVariable UUID id, Authentication authentication) {
        eggbookService.deleteNotification(AuthenticatedUser.id(authentication), id);
        return ResponseEntity.ok(new MessageResponse("Notification deleted"));
    }
}
