package com.egg.service;

import com.egg.entity.EggbookComment;
import com.egg.entity.EggbookIdea;
import com.egg.entity.EggbookNotification;
import com.egg.entity.EggbookTodo;
import com.egg.entity.Event;
import com.egg.entity.Event.EventStatus;
import com.egg.exception.EggbookPersistenceException;
import com.egg.pipeline.ExtractedEntry;
import com.egg.repository.EggbookCommentRepository;
import com.egg.repository.EggbookIdeaRepository;
import com.egg.repository.EggbookNotificationRepository;
import com.egg.repository.EggbookTodoRepository;
import com.egg.repository.EventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Writes pipeline output into the eggbook.
 *
 * Flow (one transaction per event):
 * 1. Re-read the event under a row lock
 * 2. Skip it unless it is still TRANSCRIBING (another run or the sweep moved it)
 * 3. Insert every entry with sourceEventId = the event; the first idea fills the
 *    event's placeholder idea when it has one
 * 4. Drop placeholders left unfilled and mark the event PROCESSED
 *
 * Either all of an event's entries and its PROCESSED status commit, or nothing does.
 * An event with zero entries is still marked PROCESSED.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EggbookWriter {

    private final EventRepository eventRepository;
    private final EggbookIdeaRepository ideaRepository;
    private final EggbookTodoRepository todoRepository;
    private final EggbookNotificationRepository notificationRepository;
    private final EggbookCommentRepository commentRepository;
    private final Clock clock;

    /**
     * Persist one event's entries and mark it processed.
     *
     * @param userId owner of the event and of the new entries
     * @param eventId event the entries are attributed to
     * @param entries extracted entries, possibly empty
     * @return true if written, false if the event was no longer claimed by this run
     * @throws EggbookPersistenceException if the write fails (the transaction rolls back)
     */
    @Transactional
    public boolean persistForEvent(UUID userId, UUID eventId, List<ExtractedEntry> entries) {
        try {
            Event event = eventRepository.findByIdForUpdate(eventId).orElse(null);
            if (event == null || !userId.equals(event.getUserId())) {
                log.warn("Event vanished before eggbook write: eventId={}", eventId);
                return false;
            }
            if (event.getStatus() != EventStatus.TRANSCRIBING) {
                log.info("Skipping eggbook write, event no longer claimed: eventId={}, status={}",
                        eventId, event.getStatus());
                return false;
            }

            Deque<EggbookIdea> placeholders = ideaRepository.findBySourceEventId(eventId).stream()
                    .filter(EggbookIdea::isPlaceholder)
                    .collect(Collectors.toCollection(ArrayDeque::new));

            for (ExtractedEntry entry : entries) {
                if (entry.kind() == ExtractedEntry.Kind.IDEA && !placeholders.isEmpty()) {
                    fill(placeholders.poll(), entry);
                } else {
                    insert(event, entry);
                }
            }
            if (!placeholders.isEmpty()) {
                ideaRepository.deleteAll(placeholders);
                log.info("Unfilled placeholder ideas removed: eventId={}, count={}", eventId, placeholders.size());
            }

            event.setStatus(EventStatus.PROCESSED);
            eventRepository.saveAndFlush(event);

            log.info("Eggbook entries persisted: eventId={}, entries={}", eventId, entries.size());
            return true;

        } catch (DataAccessException e) {
            throw EggbookPersistenceException.writeFailed(eventId, e);
        }
    }

    private void fill(EggbookIdea placeholder, ExtractedEntry entry) {
        placeholder.setTitle(entry.title());
        placeholder.setContent(entry.content() != null ? entry.content() : entry.title());
        ideaRepository.save(placeholder);
    }

    /**
     * Insert one entry of the given kind, attributed to {@code source}.
     */
    void insert(Event source, ExtractedEntry entry) {
        UUID userId = source.getUserId();
        UUID sourceEventId = source.getId();

        switch (entry.kind()) {
            case IDEA -> {
                EggbookIdea idea = new EggbookIdea();
                idea.setUserId(userId);
                idea.setSourceEventId(sourceEventId);
                idea.setTitle(entry.title());
                idea.setContent(entry.content() != null ? entry.content() : entry.title());
                idea.setAudioUrl(source.getAudioUrl());
                idea.setScreenRecordingUrl(source.getScreenRecordingUrl());
                idea.setRecordingUrl(source.getRecordingUrl());
                ideaRepository.save(idea);
            }
            case TODO -> {
                EggbookTodo todo = new EggbookTodo();
                todo.setUserId(userId);
                todo.setSourceEventId(sourceEventId);
                todo.setTitle(entry.title());
                todoRepository.save(todo);
            }
            case NOTIFICATION -> {
                EggbookNotification notification = new EggbookNotification();
                notification.setUserId(userId);
                notification.setSourceEventId(sourceEventId);
                notification.setTitle(entry.title());
                notification.setNotifyAt(LocalDateTime.now(clock));
                notificationRepository.save(notification);
            }
            case COMMENT -> {
                EggbookComment comment = new EggbookComment();
                comment.setUserId(userId);
                comment.setSourceEventId(sourceEventId);
                comment.setContent(entry.content() != null ? entry.content() : entry.title());
                comment.setDate(LocalDate.now(clock));
                comment.setCommunity(false);
                commentRepository.save(comment);
            }
        }
    }
}
