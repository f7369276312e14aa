package com.egg.service;

import com.egg.config.PipelineProperties;
import com.egg.dto.response.CommentGenerationResponse;
import com.egg.entity.CommentGeneration;
import com.egg.entity.CommentGeneration.GenerationStatus;
import com.egg.entity.EggbookComment;
import com.egg.entity.EggbookIdea;
import com.egg.entity.EggbookNotification;
import com.egg.entity.EggbookTodo;
import com.egg.entity.Event;
import com.egg.pipeline.CommentGenerationAdapter;
import com.egg.pipeline.CommentGenerationAdapter.CommunityComment;
import com.egg.pipeline.CommentGenerationAdapter.DailyComments;
import com.egg.repository.CommentGenerationRepository;
import com.egg.repository.EggbookCommentRepository;
import com.egg.repository.EggbookIdeaRepository;
import com.egg.repository.EggbookNotificationRepository;
import com.egg.repository.EggbookTodoRepository;
import com.egg.repository.EventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Generates the daily "egg comments" from a day's eggbook signals.
 *
 * Generation rules, checked in order:
 * 1. No audio or recording input that day → IDLE
 * 2. Automatic trigger and active duration below COMMENT_AUTO_MIN_ACTIVE_SEC → IDLE
 *    (a manual trigger skips this check)
 * 3. No idea, todo or notification created that day → IDLE
 * 4. Otherwise GENERATING, then READY with the comments stored and a
 *    "Comments ready for {date}" notification, or FAILED with the error message
 *
 * Comments and generation states older than the retention window are purged on every call.
 * Generated comments are de-duplicated on (date, channel, content, persona).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DailyCommentService {

    static final String TRIGGER_AUTO = "auto";
    static final String TRIGGER_MANUAL = "manual";

    private final CommentGenerationRepository generationRepository;
    private final EggbookCommentRepository commentRepository;
    private final EggbookIdeaRepository ideaRepository;
    private final EggbookTodoRepository todoRepository;
    private final EggbookNotificationRepository notificationRepository;
    private final EventRepository eventRepository;
    private final CommentGenerationAdapter commentGenerationAdapter;
    private final PipelineProperties properties;
    private final Clock clock;

    /**
     * Automatic generation for today, called after a successful pipeline run.
     */
    public CommentGenerationResponse triggerAuto(UUID userId) {
        return trigger(userId, LocalDate.now(clock), false);
    }

    /**
     * Run the generation rules for one user and day.
     *
     * @param userId the user
     * @param date the day to generate for
     * @param manual true for a user-initiated trigger
     * @return the resulting state; a failed generation is reported as FAILED, not thrown
     */
    public CommentGenerationResponse trigger(UUID userId, LocalDate date, boolean manual) {
        purgeExpired(userId);
        CommentGeneration state = getOrCreateState(userId, date);
        DailyInput input = dailyInput(userId, date);

        state.setHasInput(input.hasInput());
        state.setActiveDurationSec(input.activeDurationSec());
        state.setTriggerMode(manual ? TRIGGER_MANUAL : TRIGGER_AUTO);

        if (!input.hasInput()) {
            return idle(state, "No voice/screen input for the day");
        }
        if (!manual && input.activeDurationSec() < properties.getCommentAutoMinActiveSec()) {
            return idle(state, String.format("Active duration below auto threshold (%ds)",
                    properties.getCommentAutoMinActiveSec()));
        }

        state.setStatus(GenerationStatus.GENERATING);
        state.setErrorMessage(null);
        generationRepository.save(state);

        LocalDateTime start = date.atStartOfDay();
        LocalDateTime end = start.plusDays(1);
        List<EggbookIdea> ideas = ideaRepository.findCreatedBetween(userId, start, end);
        List<EggbookTodo> todos = todoRepository.findCreatedBetween(userId, start, end);
        List<EggbookNotification> alerts = notificationRepository.findCreatedBetween(userId, start, end);

        if (ideas.isEmpty() && todos.isEmpty() && alerts.isEmpty()) {
            return idle(state, "No idea/todo/alert signals for the day");
        }

        try {
            DailyComments comments = commentGenerationAdapter.generate(ideas, todos, alerts);

            upsertComment(userId, date, comments.myEggComment(), false, null, null);
            for (CommunityComment voice : comments.community()) {
                String text = voice.eggName().isEmpty()
                        ? voice.eggComment()
                        : voice.eggName() + ": " + voice.eggComment();
                upsertComment(userId, date, text, true, voice.eggName(), voice.eggComment());
            }

            state.setStatus(GenerationStatus.READY);
            state.setErrorMessage(null);
            generationRepository.save(state);
            sendReadyNotification(userId, date);

            log.info("Daily comments ready: userId={}, date={}, community={}",
                    userId, date, comments.community().size());

        } catch (RuntimeException e) {
            log.error("Daily comment generation failed: userId={}, date={}, error={}",
                    userId, date, e.getMessage());
            state.setStatus(GenerationStatus.FAILED);
            state.setErrorMessage(truncate(String.valueOf(e.getMessage()), 500));
            generationRepository.save(state);
        }

        return getState(userId, date);
    }

    /**
     * Current generation state for the day, refreshed with the day's input statistics.
     */
    public CommentGenerationResponse getState(UUID userId, LocalDate date) {
        purgeExpired(userId);
        CommentGeneration state = getOrCreateState(userId, date);
        DailyInput input = dailyInput(userId, date);

        state.setHasInput(input.hasInput());
        state.setActiveDurationSec(input.activeDurationSec());
        if (!input.hasInput()
                && (state.getStatus() == GenerationStatus.IDLE || state.getStatus() == GenerationStatus.READY)) {
            state.setStatus(GenerationStatus.IDLE);
        }
        state = generationRepository.save(state);

        return CommentGenerationResponse.builder()
                .date(date.toString())
                .status(state.getStatus().value())
                .hasInput(state.isHasInput())
                .activeDurationSec((long) state.getActiveDurationSec())
                .canManualTrigger(state.isHasInput())
                .errorMessage(state.getErrorMessage())
                .build();
    }

    /**
     * Delete comments and generation states dated before the retention window.
     */
    public void purgeExpired(UUID userId) {
        LocalDate cutoff = LocalDate.now(clock).minusDays(properties.getCommentKeepDays() - 1L);
        int comments = commentRepository.deleteOlderThan(userId, cutoff);
        int states = generationRepository.deleteOlderThan(userId, cutoff);
        if (comments + states > 0) {
            log.debug("Purged expired comment data: userId={}, comments={}, states={}", userId, comments, states);
        }
    }

    private CommentGenerationResponse idle(CommentGeneration state, String reason) {
        log.debug("Daily comments not generated: userId={}, date={}, reason={}",
                state.getUserId(), state.getDate(), reason);
        state.setStatus(GenerationStatus.IDLE);
        state.setErrorMessage(reason);
        generationRepository.save(state);
        return getState(state.getUserId(), state.getDate());
    }

    private CommentGeneration getOrCreateState(UUID userId, LocalDate date) {
        return generationRepository.findByUserIdAndDate(userId, date).orElseGet(() -> {
            try {
                return generationRepository.saveAndFlush(new CommentGeneration(userId, date));
            } catch (DataIntegrityViolationException e) {
                // concurrent creator won
                return generationRepository.findByUserIdAndDate(userId, date).orElseThrow(() -> e);
            }
        });
    }

    private DailyInput dailyInput(UUID userId, LocalDate date) {
        LocalDateTime start = date.atStartOfDay();
        List<Event> events = eventRepository.findByUserIdAndEventAtRange(userId, start, start.plusDays(1));
        boolean hasInput = events.stream().anyMatch(event -> event.hasAudio() || event.hasScreenRecording());
        double active = events.stream()
                .mapToDouble(event -> event.getDurationSec() != null ? event.getDurationSec() : 0d)
                .sum();
        return new DailyInput(hasInput, active);
    }

    private void upsertComment(UUID userId, LocalDate date, String content, boolean community,
                               String eggName, String eggComment) {
        String text = content == null ? "" : content.trim();
        if (text.isEmpty()) {
            return;
        }
        String name = community ? eggName : null;
        String voice = community ? eggComment : null;
        if (commentRepository.existsByUserIdAndDateAndCommunityAndContentAndEggNameAndEggComment(
                userId, date, community, text, name, voice)) {
            return;
        }

        EggbookComment comment = new EggbookComment();
        comment.setUserId(userId);
        comment.setContent(text);
        comment.setDate(date);
        comment.setCommunity(community);
        comment.setEggName(name);
        comment.setEggComment(voice);
        commentRepository.save(comment);
    }

    private void sendReadyNotification(UUID userId, LocalDate date) {
        String title = "Comments ready for " + date;
        if (notificationRepository.existsByUserIdAndTitle(userId, title)) {
            return;
        }
        EggbookNotification notification = new EggbookNotification();
        notification.setUserId(userId);
        notification.setTitle(title);
        notification.setNotifyAt(LocalDateTime.now(clock));
        notificationRepository.save(notification);
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }

    private record DailyInput(boolean hasInput, double activeDurationSec) {
    }
}
