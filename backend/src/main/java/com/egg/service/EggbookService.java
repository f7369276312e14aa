package com.egg.service;

import com.egg.config.PipelineProperties;
import com.egg.dto.request.CommentCreateRequest;
import com.egg.dto.request.IdeaCreateRequest;
import com.egg.dto.request.NotificationCreateRequest;
import com.egg.dto.request.ScheduleRequest;
import com.egg.dto.request.TodoCreateRequest;
import com.egg.dto.request.TodoUpdateRequest;
import com.egg.dto.response.CommentResponse;
import com.egg.dto.response.CommentsResponse;
import com.egg.dto.response.IdeaResponse;
import com.egg.dto.response.NotificationResponse;
import com.egg.dto.response.SyncStatusResponse;
import com.egg.dto.response.TodoResponse;
import com.egg.entity.EggbookComment;
import com.egg.entity.EggbookIdea;
import com.egg.entity.EggbookNotification;
import com.egg.entity.EggbookTodo;
import com.egg.entity.Event.EventStatus;
import com.egg.exception.ResourceNotFoundException;
import com.egg.pipeline.CooldownGate;
import com.egg.repository.EggbookCommentRepository;
import com.egg.repository.EggbookIdeaRepository;
import com.egg.repository.EggbookNotificationRepository;
import com.egg.repository.EggbookTodoRepository;
import com.egg.repository.EventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * CRUD over the user's eggbook: ideas, todos, notifications and comments.
 *
 * Every lookup is scoped to the caller; an item owned by someone else is reported
 * as not found.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EggbookService {

    private final EggbookIdeaRepository ideaRepository;
    private final EggbookTodoRepository todoRepository;
    private final EggbookNotificationRepository notificationRepository;
    private final EggbookCommentRepository commentRepository;
    private final EventRepository eventRepository;
    private final DailyCommentService dailyCommentService;
    private final CooldownGate cooldownGate;
    private final PipelineProperties properties;
    private final Clock clock;

    // Ideas

    public List<IdeaResponse> listIdeas(UUID userId) {
        return ideaRepository.findByUserIdOrderByCreatedAtDesc(userId).stream().map(this::toResponse).toList();
    }

    @Transactional
    public IdeaResponse createIdea(UUID userId, IdeaCreateRequest request) {
        EggbookIdea idea = new EggbookIdea();
        idea.setUserId(userId);
        idea.setTitle(request.getTitle());
        idea.setContent(request.getContent());
        return toResponse(ideaRepository.save(idea));
    }

    public IdeaResponse getIdea(UUID userId, UUID ideaId) {
        return toResponse(findIdea(userId, ideaId));
    }

    @Transactional
    public void deleteIdea(UUID userId, UUID ideaId) {
        ideaRepository.delete(findIdea(userId, ideaId));
        log.info("Idea deleted: ideaId={}, userId={}", ideaId, userId);
    }

    // Todos

    public List<TodoResponse> listTodos(UUID userId) {
        return todoRepository.findByUserIdOrderByCreatedAtDesc(userId).stream().map(this::toResponse).toList();
    }

    @Transactional
    public TodoResponse createTodo(UUID userId, TodoCreateRequest request) {
        EggbookTodo todo = new EggbookTodo();
        todo.setUserId(userId);
        todo.setTitle(request.getTitle());
        return toResponse(todoRepository.save(todo));
    }

    @Transactional
    public TodoResponse updateTodo(UUID userId, UUID todoId, TodoUpdateRequest request) {
        EggbookTodo todo = findTodo(userId, todoId);
        if (request.getTitle() != null) {
            todo.setTitle(request.getTitle());
        }
        if (request.getAccepted() != null) {
            todo.setAccepted(request.getAccepted());
        }
        if (request.getPinned() != null) {
            todo.setPinned(request.getPinned());
        }
        return toResponse(todoRepository.saveAndFlush(todo));
    }

    @Transactional
    public void deleteTodo(UUID userId, UUID todoId) {
        todoRepository.delete(findTodo(userId, todoId));
        log.info("Todo deleted: todoId={}, userId={}", todoId, userId);
    }

    /**
     * Accepting a todo also pins it.
     */
    @Transactional
    public TodoResponse acceptTodo(UUID userId, UUID todoId) {
        EggbookTodo todo = findTodo(userId, todoId);
        todo.setAccepted(true);
        todo.setPinned(true);
        return toResponse(todoRepository.saveAndFlush(todo));
    }

    /**
     * Create a notification for the todo at the requested time.
     */
    @Transactional
    public NotificationResponse scheduleTodo(UUID userId, UUID todoId, ScheduleRequest request) {
        EggbookTodo todo = findTodo(userId, todoId);

        EggbookNotification notification = new EggbookNotification();
        notification.setUserId(userId);
        notification.setTodoId(todo.getId());
        notification.setTitle(todo.getTitle());
        notification.setNotifyAt(request.getNotifyAt());

        log.info("Todo scheduled: todoId={}, notifyAt={}", todoId, request.getNotifyAt());
        return toResponse(notificationRepository.save(notification));
    }

    // Notifications

    public List<NotificationResponse> listNotifications(UUID userId) {
        return notificationRepository.findByUserIdOrderByNotifyAtAsc(userId).stream().map(this::toResponse).toList();
    }

    @Transactional
    public NotificationResponse createNotification(UUID userId, NotificationCreateRequest request) {
        if (request.getTodoId() != null) {
            findTodo(userId, request.getTodoId());
        }
        EggbookNotification notification = new EggbookNotification();
        notification.setUserId(userId);
        notification.setTodoId(request.getTodoId());
        notification.setTitle(request.getTitle());
        notification.setNotifyAt(request.getNotifyAt());
        return toResponse(notificationRepository.save(notification));
    }

    @Transactional
    public NotificationResponse rescheduleNotification(UUID userId, UUID notificationId, ScheduleRequest request) {
        EggbookNotification notification = findNotification(userId, notificationId);
        notification.setNotifyAt(request.getNotifyAt());
        return toResponse(notificationRepository.saveAndFlush(notification));
    }

    @Transactional
    public void deleteNotification(UUID userId, UUID notificationId) {
        notificationRepository.delete(findNotification(userId, notificationId));
    }

    // Comments

    /**
     * Comments dated in [date, date + days), split into the user's own and the community channel.
     * Expired comments are purged first.
     *
     * @throws IllegalArgumentException if days is outside 1..7
     */
    public CommentsResponse listComments(UUID userId, LocalDate date, int days) {
        if (days < 1 || days > properties.getCommentKeepDays()) {
            throw new IllegalArgumentException(
                    String.format("days must be between 1 and %d", properties.getCommentKeepDays()));
        }
        dailyCommentService.purgeExpired(userId);

        List<CommentResponse> comments = commentRepository.findInDateRange(userId, date, date.plusDays(days))
                .stream()
                .map(this::toResponse)
                .toList();

        return CommentsResponse.builder()
                .myEgg(comments.stream().filter(comment -> !comment.isCommunity()).toList())
                .community(comments.stream().filter(CommentResponse::isCommunity).toList())
                .build();
    }

    /**
     * @throws IllegalArgumentException if there is no text
     */
    @Transactional
    public CommentResponse createComment(UUID userId, CommentCreateRequest request) {
        boolean community = Boolean.TRUE.equals(request.getCommunity());
        String content = community && hasText(request.getEggComment()) ? request.getEggComment() : request.getContent();
        if (!hasText(content)) {
            throw new IllegalArgumentException("content is required");
        }

        EggbookComment comment = new EggbookComment();
        comment.setUserId(userId);
        comment.setContent(content.trim());
        comment.setEggName(community ? request.getEggName() : null);
        comment.setEggComment(community ? request.getEggComment() : null);
        comment.setDate(request.getDate() != null ? request.getDate() : LocalDate.now(clock));
        comment.setCommunity(community);
        return toResponse(commentRepository.save(comment));
    }

    // Sync

    /**
     * Whether the pipeline still has work for the user. Clients poll this after uploading.
     * Unfilled placeholder ideas count as work in progress.
     */
    public SyncStatusResponse getSyncStatus(UUID userId) {
        long pendingEvents = eventRepository.countByUserIdAndStatusIn(
                userId, List.of(EventStatus.PENDING, EventStatus.TRANSCRIBING));
        boolean processing = pendingEvents > 0
                || ideaRepository.countPlaceholders(userId) > 0
                || cooldownGate.state(userId).processing();
        long items = ideaRepository.countByUserId(userId)
                + todoRepository.countByUserId(userId)
                + notificationRepository.countByUserId(userId);

        return SyncStatusResponse.builder()
                .status("ok")
                .lastSyncAt(null)
                .processing(processing)
                .hasUpdates(!processing && items > 0)
                .pendingEvents(pendingEvents)
                .build();
    }

    private EggbookIdea findIdea(UUID userId, UUID ideaId) {
        return ideaRepository.findByIdAndUserId(ideaId, userId)
                .orElseThrow(() -> ResourceNotFoundException.of("Idea"));
    }

    private EggbookTodo findTodo(UUID userId, UUID todoId) {
        return todoRepository.findByIdAndUserId(todoId, userId)
                .orElseThrow(() -> ResourceNotFoundException.of("Todo"));
    }

    private EggbookNotification findNotification(UUID userId, UUID notificationId) {
        return notificationRepository.findByIdAndUserId(notificationId, userId)
                .orElseThrow(() -> ResourceNotFoundException.of("Notification"));
    }

    private IdeaResponse toResponse(EggbookIdea idea) {
        return IdeaResponse.builder()
                .id(idea.getId())
                .sourceEventId(idea.getSourceEventId())
                .title(idea.getTitle())
                .content(idea.getContent())
                .screenRecordingUrl(idea.getScreenRecordingUrl())
                .recordingUrl(idea.getRecordingUrl())
                .audioUrl(idea.getAudioUrl())
                .createdAt(idea.getCreatedAt())
                .updatedAt(idea.getUpdatedAt())
                .build();
    }

    private TodoResponse toResponse(EggbookTodo todo) {
        return TodoResponse.builder()
                .id(todo.getId())
                .sourceEventId(todo.getSourceEventId())
                .title(todo.getTitle())
                .accepted(todo.isAccepted())
                .pinned(todo.isPinned())
                .createdAt(todo.getCreatedAt())
                .updatedAt(todo.getUpdatedAt())
                .build();
    }

    private NotificationResponse toResponse(EggbookNotification notification) {
        return NotificationResponse.builder()
                .id(notification.getId())
                .sourceEventId(notification.getSourceEventId())
                .title(notification.getTitle())
                .todoId(notification.getTodoId())
                .notifyAt(notification.getNotifyAt())
                .createdAt(notification.getCreatedAt())
                .updatedAt(notification.getUpdatedAt())
                .build();
    }

    private CommentResponse toResponse(EggbookComment comment) {
        String content = comment.isCommunity() && hasText(comment.getEggComment())
                ? comment.getEggComment()
                : comment.getContent();
        return CommentResponse.builder()
                .id(comment.getId())
                .sourceEventId(comment.getSourceEventId())
                .content(content)
                .eggName(comment.getEggName())
                .eggComment(comment.getEggComment())
                .date(comment.getDate())
                .community(comment.isCommunity())
                .createdAt(comment.getCreatedAt())
                .build();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
