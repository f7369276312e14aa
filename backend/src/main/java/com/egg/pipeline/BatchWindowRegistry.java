package com.egg.pipeline;

import com.egg.config.PipelineProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-user batch windows: unprocessed events waiting for batched inference.
 *
 * A window flushes when it holds {@code batchTriggerCount} events, or when its oldest
 * event (by event time) is at least {@code batchMaxWaitHours} old, even if it holds only
 * one event. Every operation on a user's window runs inside
 * {@link ConcurrentHashMap#compute}, so offer, remove and drain are atomic per user.
 *
 * Windows live in process memory. {@link PipelineSweeper} re-offers pending batchable
 * events from the database on every pass, which rebuilds them after a restart.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BatchWindowRegistry {

    private static final Comparator<Map.Entry<UUID, LocalDateTime>> OLDEST_FIRST =
            Map.Entry.<UUID, LocalDateTime>comparingByValue().thenComparing(Map.Entry.comparingByKey());

    private final PipelineProperties properties;
    private final Clock clock;

    private final ConcurrentHashMap<UUID, Map<UUID, LocalDateTime>> windows = new ConcurrentHashMap<>();

    /**
     * Add an event to the user's window. Offering the same event twice keeps one entry
     * (with the latest event time).
     */
    public void offer(UUID userId, UUID eventId, LocalDateTime eventAt) {
        windows.compute(userId, (key, window) -> {
            Map<UUID, LocalDateTime> target = window != null ? window : new HashMap<>();
            target.put(eventId, eventAt);
            return target;
        });
        log.debug("Event offered to batch window: userId={}, eventId={}", userId, eventId);
    }

    /**
     * @return true if the event was in the window
     */
    public boolean remove(UUID userId, UUID eventId) {
        boolean[] removed = new boolean[1];
        windows.computeIfPresent(userId, (key, window) -> {
            removed[0] = window.remove(eventId) != null;
            return window.isEmpty() ? null : window;
        });
        return removed[0];
    }

    public boolean contains(UUID userId, UUID eventId) {
        boolean[] present = new boolean[1];
        windows.computeIfPresent(userId, (key, window) -> {
            present[0] = window.containsKey(eventId);
            return window;
        });
        return present[0];
    }

    public int size(UUID userId) {
        return snapshot(userId).size();
    }

    /**
     * Whether the user's window meets a flush condition right now.
     */
    public boolean shouldFlush(UUID userId) {
        return snapshot(userId).flushable();
    }

    /**
     * Atomically remove and return up to {@code max} events, oldest first.
     * Events beyond {@code max} stay queued.
     */
    public List<UUID> drain(UUID userId, int max) {
        List<UUID> drained = new ArrayList<>();
        windows.computeIfPresent(userId, (key, window) -> {
            window.entrySet().stream()
                    .sorted(OLDEST_FIRST)
                    .limit(max)
                    .map(Map.Entry::getKey)
                    .forEach(drained::add);
            drained.forEach(window::remove);
            return window.isEmpty() ? null : window;
        });
        if (!drained.isEmpty()) {
            log.info("Batch window drained: userId={}, drained={}, remaining={}",
                    userId, drained.size(), size(userId));
        }
        return drained;
    }

    /**
     * Consistent view of one user's window.
     */
    public WindowState snapshot(UUID userId) {
        int[] size = new int[1];
        LocalDateTime[] oldest = new LocalDateTime[1];
        windows.computeIfPresent(userId, (key, window) -> {
            size[0] = window.size();
            oldest[0] = window.values().stream().min(Comparator.naturalOrder()).orElse(null);
            return window;
        });

        boolean waitExceeded = oldest[0] != null
                && Duration.between(oldest[0], LocalDateTime.now(clock)).compareTo(properties.batchMaxWait()) >= 0;
        boolean countReached = size[0] > 0 && size[0] >= properties.getBatchTriggerCount();
        return new WindowState(size[0], oldest[0], countReached, waitExceeded);
    }

    /**
     * Users that currently have a non-empty window.
     */
    public Set<UUID> users() {
        return Set.copyOf(windows.keySet());
    }

    /**
     * @param size queued events
     * @param oldestEventAt event time of the oldest queued event, null if empty
     * @param countReached size reached the trigger count
     * @param waitExceeded oldest event waited at least the max wait
     */
    public record WindowState(int size, LocalDateTime oldestEventAt, boolean countReached, boolean waitExceeded) {

        public boolean flushable() {
            return countReached || waitExceeded;
        }
    }
}
