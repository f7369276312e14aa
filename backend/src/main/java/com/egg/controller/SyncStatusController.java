package com.egg.controller;

import com.egg.dto.response.SyncStatusResponse;
import com.egg.security.AuthenticatedUser;
import com.egg.service.EggbookService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class SyncStatusController {

    private final EggbookService eggbookService;

    @GetMapping("/v1/eggbook/sync-status")
    public ResponseEntity<SyncStatusResponse> syncStatus(Authentication authentication) {
        return ResponseEntity.ok(eggbookService.getSyncStatus(AuthenticatedUser.id(authentication)));
    }
}
