package com.egg.pipeline;

import com.egg.config.PipelineProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-instance cooldown gate backed by a {@link ConcurrentHashMap}.
 *
 * {@code compute} runs the check and the update for one user under the map's bin lock,
 * so two concurrent callers can never both acquire.
 */
@Component
@ConditionalOnProperty(name = "app.pipeline.cooldown-store", havingValue = "memory", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class InMemoryCooldownGate implements CooldownGate {

    private final PipelineProperties properties;
    private final Clock clock;

    private final ConcurrentHashMap<UUID, Slot> slots = new ConcurrentHashMap<>();

    @Override
    public boolean tryAcquire(UUID userId) {
        Instant now = clock.instant();
        Duration cooldown = properties.userCooldown();
        boolean[] granted = new boolean[1];

        slots.compute(userId, (key, slot) -> {
            if (slot != null && slot.processing()) {
                return slot;
            }
            if (slot != null && slot.lastAttemptAt().plus(cooldown).isAfter(now)) {
                return slot;
            }
            granted[0] = true;
            return new Slot(now, true);
        });

        if (!granted[0]) {
            log.debug("Cooldown gate denied: userId={}", userId);
        }
        return granted[0];
    }

    @Override
    public void release(UUID userId) {
        slots.computeIfPresent(userId, (key, slot) -> new Slot(slot.lastAttemptAt(), false));
    }

    @Override
    public GateState state(UUID userId) {
        Slot slot = slots.get(userId);
        if (slot == null) {
            return new GateState(false, Duration.ZERO);
        }
        Duration remaining = Duration.between(clock.instant(), slot.lastAttemptAt().plus(properties.userCooldown()));
        return new GateState(slot.processing(), remaining.isNegative() ? Duration.ZERO : remaining);
    }

    private record Slot(Instant lastAttemptAt, boolean processing) {
    }
}
