package com.egg.pipeline;

import com.egg.entity.Event;
import com.egg.entity.Event.EventStatus;
import com.egg.exception.EggbookPersistenceException;
import com.egg.exception.ExtractionException;
import com.egg.exception.TranscriptionException;
import com.egg.repository.EventRepository;
import com.egg.service.EggbookWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Runs one pipeline pass over a set of events: transcription, extraction, eggbook write.
 *
 * Flow:
 * 1. Claim: keep the user's events in {pending, transcribing, failed}, order them by event
 *    time and atomically move each to TRANSCRIBING. Processed events are skipped, so
 *    re-running a run never duplicates eggbook entries.
 * 2. Transcribe events lacking a transcript (audio, then screen recording, then the legacy
 *    recording column). The transcript is stored as soon as it is produced.
 * 3. Extract entries from the ordered transcripts, with timeout, retry and backoff.
 * 4. Attribute entries to events and write them, one transaction per event.
 *
 * Error Handling:
 * - Transient transcription errors are retried per source with the extraction backoff
 * - Transcription failure (permanent or retries exhausted on every source): only that
 *   event becomes FAILED, the rest of the run continues
 * - Extraction failure (permanent or retries exhausted): every surviving event becomes FAILED,
 *   transcripts already stored are kept
 * - Persistence failure: only that event becomes FAILED
 * - Anything unexpected: every claimed event not yet terminal becomes FAILED
 *
 * No event claimed by a run is left in TRANSCRIBING when the run returns.
 * Failures are recorded on the events and never thrown to the caller.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PipelineOrchestrator {

    private final EventRepository eventRepository;
    private final TranscriptionAdapter transcriptionAdapter;
    private final ExtractionAdapter extractionAdapter;
    private final ExtractionRetryExecutor retryExecutor;
    private final TranscriptionRetryExecutor transcriptionRetryExecutor;
    private final EggbookWriter eggbookWriter;
    private final Clock clock;

    /**
     * Execute a single or batched run.
     *
     * @param run the user, the mode and the event ids to process
     * @return ids that ended processed, failed or were skipped, and the number of entries written
     */
    public PipelineResult execute(PipelineRun run) {
        log.info("Pipeline run started: userId={}, mode={}, events={}",
                run.userId(), run.mode(), run.eventIds().size());

        List<UUID> skipped = new ArrayList<>();
        List<Event> claimed = claim(run, skipped);
        if (claimed.isEmpty()) {
            log.info("Pipeline run has nothing to do: userId={}, skipped={}", run.userId(), skipped.size());
            return new PipelineResult(List.of(), List.of(), skipped, 0, false);
        }

        List<UUID> processed = new ArrayList<>();
        Set<UUID> failed = new LinkedHashSet<>();
        int entriesCreated = 0;

        try {
            // Step 1: transcription
            List<Event> surviving = transcribeMissing(claimed, failed);
            if (surviving.isEmpty()) {
                return finish(run, processed, failed, skipped, 0);
            }

            // Step 2: ordered inputs
            List<TranscriptInput> inputs = surviving.stream()
                    .map(event -> new TranscriptInput(event.getId(), event.getEventAt(), event.getTranscript().trim()))
                    .toList();

            // Step 3: extraction
            List<ExtractedEntry> entries;
            try {
                entries = retryExecutor.execute(() -> extractionAdapter.extract(inputs, run.mode()));
            } catch (ExtractionException e) {
                log.error("Extraction failed for run: userId={}, mode={}, errorCode={}, message={}",
                        run.userId(), run.mode(), e.getErrorCode(), e.getMessage());
                List<UUID> ids = surviving.stream().map(Event::getId).toList();
                ids.forEach(this::markFailed);
                failed.addAll(ids);
                return finish(run, processed, failed, skipped, 0);
            }

            // Step 4: attribution and write
            Map<UUID, List<ExtractedEntry>> byEvent = attribute(entries, surviving);
            for (Map.Entry<UUID, List<ExtractedEntry>> target : byEvent.entrySet()) {
                UUID eventId = target.getKey();
                try {
                    if (eggbookWriter.persistForEvent(run.userId(), eventId, target.getValue())) {
                        processed.add(eventId);
                        entriesCreated += target.getValue().size();
                    } else {
                        skipped.add(eventId);
                    }
                } catch (RuntimeException e) {
                    EggbookPersistenceException failure = e instanceof EggbookPersistenceException persistence
                            ? persistence
                            : EggbookPersistenceException.writeFailed(eventId, e);
                    log.error("Eggbook write failed: eventId={}, errorCode={}, message={}",
                            eventId, failure.getErrorCode(), failure.getMessage(), e);
                    markFailed(eventId);
                    failed.add(eventId);
                }
            }

            return finish(run, processed, failed, skipped, entriesCreated);

        } catch (RuntimeException e) {
            log.error("Unexpected pipeline error: userId={}, mode={}, error={}",
                    run.userId(), run.mode(), e.getMessage(), e);
            for (Event event : claimed) {
                UUID eventId = event.getId();
                if (!processed.contains(eventId) && !failed.contains(eventId) && !skipped.contains(eventId)) {
                    markFailed(eventId);
                    failed.add(eventId);
                }
            }
            return finish(run, processed, failed, skipped, entriesCreated);
        }
    }

    /**
     * Transcribe one event outside of an inference run and put it back to PENDING,
     * so it can be re-classified (typically into the batch window).
     *
     * @param eventId event holding audio but no transcript
     * @return true if a transcript was stored
     */
    public boolean transcribeEvent(UUID eventId) {
        Event event = eventRepository.findById(eventId).orElse(null);
        if (event == null || event.getStatus() != EventStatus.PENDING) {
            log.debug("Skipping standalone transcription: eventId={}", eventId);
            return false;
        }
        if (event.hasTranscript()) {
            return false;
        }
        if (!eventRepository.claim(eventId, now())) {
            log.debug("Event already claimed, skipping standalone transcription: eventId={}", eventId);
            return false;
        }

        try {
            String transcript = transcribe(event);
            eventRepository.updateTranscript(eventId, transcript, now());
            eventRepository.compareAndSetStatus(eventId, List.of(EventStatus.TRANSCRIBING), EventStatus.PENDING, now());
            log.info("Standalone transcription stored: eventId={}, length={}", eventId, transcript.length());
            return true;
        } catch (RuntimeException e) {
            log.error("Standalone transcription failed: eventId={}, error={}", eventId, e.getMessage());
            markFailed(eventId);
            return false;
        }
    }

    private List<Event> claim(PipelineRun run, List<UUID> skipped) {
        List<Event> loaded = eventRepository.findAllById(run.eventIds());
        Set<UUID> found = new LinkedHashSet<>();
        List<Event> claimed = new ArrayList<>();

        loaded.stream()
                .filter(event -> run.userId().equals(event.getUserId()))
                .sorted(Comparator.comparing(Event::getEventAt).thenComparing(Event::getId))
                .forEach(event -> {
                    found.add(event.getId());
                    if (!Event.RUNNABLE_STATUSES.contains(event.getStatus())) {
                        log.debug("Skipping event not eligible for processing: eventId={}, status={}",
                                event.getId(), event.getStatus());
                        skipped.add(event.getId());
                    } else if (eventRepository.claim(event.getId(), now())) {
                        claimed.add(event);
                    } else {
                        log.debug("Event claimed by another run: eventId={}", event.getId());
                        skipped.add(event.getId());
                    }
                });

        run.eventIds().stream().filter(id -> !found.contains(id)).forEach(skipped::add);
        return claimed;
    }

    private List<Event> transcribeMissing(List<Event> claimed, Set<UUID> failed) {
        List<Event> surviving = new ArrayList<>();
        for (Event event : claimed) {
            if (event.hasTranscript()) {
                surviving.add(event);
                continue;
            }
            try {
                String transcript = transcribe(event);
                eventRepository.updateTranscript(event.getId(), transcript, now());
                event.setTranscript(transcript);
                surviving.add(event);
            } catch (RuntimeException e) {
                log.error("Transcription failed, excluding event from run: eventId={}, error={}",
                        event.getId(), e.getMessage());
                markFailed(event.getId());
                failed.add(event.getId());
            }
        }
        return surviving;
    }

    /**
     * Try each media source in order; the first non-empty transcript wins.
     */
    private String transcribe(Event event) {
        List<String> sources = event.transcriptionSources();
        if (sources.isEmpty()) {
            throw TranscriptionException.noMediaSource(String.valueOf(event.getId()));
        }

        TranscriptionException lastFailure = null;
        for (String source : sources) {
            try {
                String text = transcriptionRetryExecutor.execute(source, () -> transcriptionAdapter.transcribe(source));
                if (text != null && !text.isBlank()) {
                    return text.trim();
                }
                lastFailure = TranscriptionException.emptyTranscription(source);
            } catch (TranscriptionException e) {
                log.warn("Transcription source failed: eventId={}, errorCode={}, trying next source",
                        event.getId(), e.getErrorCode());
                lastFailure = e;
            }
        }
        throw lastFailure;
    }

    /**
     * Group entries by target event. An entry goes to its first source id that belongs to
     * the run, else to the first (earliest) surviving event. Every surviving event gets a
     * key, even with no entries, so it still reaches PROCESSED.
     */
    Map<UUID, List<ExtractedEntry>> attribute(List<ExtractedEntry> entries, List<Event> surviving) {
        Map<UUID, List<ExtractedEntry>> byEvent = new LinkedHashMap<>();
        surviving.forEach(event -> byEvent.put(event.getId(), new ArrayList<>()));
        UUID fallback = surviving.get(0).getId();

        for (ExtractedEntry entry : entries) {
            UUID target = entry.sourceEventIds().stream()
                    .filter(byEvent::containsKey)
                    .findFirst()
                    .orElse(fallback);
            byEvent.get(target).add(entry);
        }
        return byEvent;
    }

    private void markFailed(UUID eventId) {
        eventRepository.compareAndSetStatus(eventId, List.of(EventStatus.TRANSCRIBING), EventStatus.FAILED, now());
    }

    private PipelineResult finish(PipelineRun run, List<UUID> processed, Set<UUID> failed,
                                  List<UUID> skipped, int entriesCreated) {
        log.info("Pipeline run finished: userId={}, mode={}, processed={}, failed={}, skipped={}, entries={}",
                run.userId(), run.mode(), processed.size(), failed.size(), skipped.size(), entriesCreated);
        return new PipelineResult(processed, new ArrayList<>(failed), skipped, entriesCreated, false);
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
