package com.egg.controller;

import com.egg.dto.response.AuthResponse;
import com.egg.service.AuthService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for anonymous authentication.
 *
 * Endpoints:
 * - POST /v1/auth/anonymous - create a user and return its JWT
 *
 * Public endpoint (no authentication required).
 */
@RestController
@RequestMapping("/v1/auth")
@RequiredArgsConstructor
@Slf4j
public class AuthController {

    private final AuthService authService;

    /**
     * Create an anonymous user.
     *
     * Response:
     * <pre>
     * {"userId": "3f0c...", "token": "eyJhbGciOiJIUzI1NiJ9..."}
     * </pre>
     */
    @PostMapping("/anonymous")
    public ResponseEntity<AuthResponse> anonymous() {
        log.info("Anonymous login requested");

        try {
            AuthResponse response = authService.createAnonymousUser();
            return ResponseEntity.ok(response);

        } catch (Exception e) {
            log.error("Unexpected error during anonymous login", e);
            throw e;  // GlobalExceptionHandler will handle this
        }
    }
}
