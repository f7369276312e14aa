package com.egg.pipeline;

import com.egg.config.PipelineProperties;
import com.egg.exception.TranscriptionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded retry loop around one speech-to-text call.
 *
 * Shares the extraction budget and backoff (GEMINI_RETRY_MAX_ATTEMPTS attempts,
 * GEMINI_RETRY_BASE_DELAY_SEC doubled per retry). Only transient TranscriptionExceptions
 * are retried; the call itself is bounded by the HTTP client's timeouts, so no executor
 * is involved.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TranscriptionRetryExecutor {

    private final PipelineProperties properties;
    private final Sleeper sleeper;

    /**
     * @param mediaRef media being transcribed, for logging
     * @param call the transcription call
     * @return the first successful result
     * @throws TranscriptionException permanent failure, or retries exhausted
     */
    public String execute(String mediaRef, Supplier<String> call) {
        int maxAttempts = Math.max(1, properties.getRetryMaxAttempts());
        TranscriptionException lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                Duration delay = backoffDelay(attempt);
                log.warn("Retrying transcription: mediaRef={}, attempt={}/{}, delayMs={}, lastError={}",
                        mediaRef, attempt, maxAttempts, delay.toMillis(), lastFailure.getErrorCode());
                pause(mediaRef, delay);
            }

            try {
                return call.get();
            } catch (TranscriptionException e) {
                if (!e.isTransient()) {
                    throw e;
                }
                lastFailure = e;
            }
        }

        log.error("Transcription retries exhausted: mediaRef={}, attempts={}, lastError={}",
                mediaRef, maxAttempts, lastFailure.getErrorCode());
        throw TranscriptionException.retriesExhausted(maxAttempts, lastFailure);
    }

    Duration backoffDelay(int attempt) {
        long baseMs = properties.retryBaseDelay().toMillis();
        return Duration.ofMillis(baseMs * (1L << Math.min(attempt - 2, 20)));
    }

    private void pause(String mediaRef, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw TranscriptionException.providerFailed(mediaRef, false, e);
        }
    }
}
