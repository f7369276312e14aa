package com.egg.pipeline;

import java.time.Duration;
import java.util.UUID;

/**
 * Serializes AI work per user and spaces out attempts.
 *
 * {@link #tryAcquire(UUID)} grants a slot only if the user has no run in progress and
 * the previous attempt began at least the configured cooldown ago. Test and set happen
 * atomically. A denied caller does not drop anything: the events stay pending and are
 * picked up by a later ingestion or by the sweep.
 *
 * Callers must pair every successful acquire with {@link #release(UUID)} in a finally block.
 */
public interface CooldownGate {

    /**
     * @param userId user whose pipeline is about to run
     * @return true if the caller now holds the user's slot
     */
    boolean tryAcquire(UUID userId);

    /**
     * Clear the processing flag. The cooldown keeps counting from the attempt start.
     */
    void release(UUID userId);

    /**
     * Current gate state, for diagnostics.
     */
    GateState state(UUID userId);

    /**
     * @param processing a run is in progress for the user
     * @param cooldownRemaining time until a new attempt may start, zero if none
     */
    record GateState(boolean processing, Duration cooldownRemaining) {
    }
}
