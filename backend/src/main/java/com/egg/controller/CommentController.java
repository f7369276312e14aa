package com.egg.controller;

import com.egg.dto.request.CommentCreateRequest;
import com.egg.dto.request.CommentGenerateRequest;
import com.egg.dto.response.CommentGenerationResponse;
import com.egg.dto.response.CommentResponse;
import com.egg.dto.response.CommentsResponse;
import com.egg.dto.response.ItemResponse;
import com.egg.security.AuthenticatedUser;
import com.egg.service.DailyCommentService;
import com.egg.service.EggbookService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;

/**
 * REST controller for daily egg comments.
 *
 * Endpoints:
 * - GET  /v1/eggbook/comments?date=YYYY-MM-DD&days=1..7 - {"myEgg": [...], "community": [...]}
 * - POST /v1/eggbook/comments                          - manual comment
 * - GET  /v1/eggbook/comments/status?date=YYYY-MM-DD   - generation state for the day
 * - POST /v1/eggbook/comments/generate                 - manual generation (skips the active-time threshold)
 */
@RestController
@RequestMapping("/v1/eggbook/comments")
@RequiredArgsConstructor
@Slf4j
public class CommentController {

    private final EggbookService eggbookService;
    private final DailyCommentService dailyCommentService;
    private final Clock clock;

    @GetMapping
    public ResponseEntity<CommentsResponse> list(
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(value = "days", defaultValue = "7") int days,
            Authentication authentication) {
        return ResponseEntity.ok(eggbookService.listComments(AuthenticatedUser.id(authentication), date, days));
    }

    @PostMapping
    public ResponseEntity<ItemResponse<CommentResponse>> create(
            @RequestBody CommentCreateRequest request,
            Authentication authentication) {
        return ResponseEntity.ok(new ItemResponse<>(
                eggbookService.createComment(AuthenticatedUser.id(authentication), request)));
    }

    @GetMapping("/status")
    public ResponseEntity<CommentGenerationResponse> status(
            @RequestParam("date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            Authentication authentication) {
        return ResponseEntity.ok(dailyCommentService.getState(AuthenticatedUser.id(authentication), date));
    }

    @PostMapping("/generate")
    public ResponseEntity<CommentGenerationResponse> generate(
            @RequestBody(required = false) CommentGenerateRequest request,
            Authentication authentication) {
        UUID userId = AuthenticatedUser.id(authentication);
        LocalDate date = request != null && request.getDate() != null ? request.getDate() : LocalDate.now(clock);

        log.info("Manual comment generation: userId={}, date={}", userId, date);
        return ResponseEntity.ok(dailyCommentService.trigger(userId, date, true));
    }
}
