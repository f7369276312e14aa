package com.egg.pipeline;

import com.egg.config.PipelineProperties;
import com.egg.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InMemoryCooldownGate Unit Tests")
class InMemoryCooldownGateTest {

    private MutableClock clock;
    private InMemoryCooldownGate gate;
    private UUID userId;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-02T10:00:00Z");
        PipelineProperties properties = new PipelineProperties();
        properties.setUserCooldownSec(8);
        gate = new InMemoryCooldownGate(properties, clock);
        userId = UUID.randomUUID();
    }

    @Test
    @DisplayName("first acquire should succeed and mark the user processing")
    void testTryAcquire_First() {
        // Act
        boolean acquired = gate.tryAcquire(userId);

        // Assert
        assertTrue(acquired);
        assertTrue(gate.state(userId).processing());
    }

    @Test
    @DisplayName("acquire should be denied while a run is in progress, even after the cooldown")
    void testTryAcquire_DeniedWhileProcessing() {
        // Arrange
        gate.tryAcquire(userId);
        clock.advance(Duration.ofSeconds(30));

        // Act & Assert
        assertFalse(gate.tryAcquire(userId));
    }

    @Test
    @DisplayName("acquire should be denied within the cooldown and allowed after it")
    void testTryAcquire_Cooldown() {
        // Arrange
        gate.tryAcquire(userId);
        gate.release(userId);
        clock.advance(Duration.ofSeconds(5));

        // Act & Assert
        assertFalse(gate.tryAcquire(userId));
        assertEquals(Duration.ofSeconds(3), gate.state(userId).cooldownRemaining());

        clock.advance(Duration.ofSeconds(3));
        assertTrue(gate.tryAcquire(userId));
    }

    @Test
    @DisplayName("gates of different users should not interfere")
    void testTryAcquire_PerUser() {
        // Arrange
        gate.tryAcquire(userId);

        // Act & Assert
        assertTrue(gate.tryAcquire(UUID.randomUUID()));
    }

    @Test
    @DisplayName("state of an unknown user should be idle with no cooldown")
    void testState_UnknownUser() {
        // Act
        CooldownGate.GateState state = gate.state(UUID.randomUUID());

        // Assert
        assertFalse(state.processing());
        assertEquals(Duration.ZERO, state.cooldownRemaining());
    }

    @Test
    @DisplayName("concurrent acquires for one user should grant exactly one")
    void testTryAcquire_Concurrent() throws Exception {
        // Arrange
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        try {
            for (int i = 0; i < threads; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return gate.tryAcquire(userId);
                }));
            }

            // Act
            start.countDown();
            int granted = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    granted++;
                }
            }

            // Assert
            assertEquals(1, granted);
        } finally {
            pool.shutdownNow();
        }
    }
}
