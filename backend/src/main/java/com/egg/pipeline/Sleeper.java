package com.egg.pipeline;

import java.time.Duration;

/**
 * Blocking pause used between extraction retry attempts.
 * Injected so tests can record delays instead of waiting.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;
}
