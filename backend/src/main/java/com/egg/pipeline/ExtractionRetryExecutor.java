package com.egg.pipeline;

import com.egg.config.PipelineProperties;
import com.egg.exception.ExtractionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Bounded retry loop around an extraction call.
 *
 * Each attempt runs on the extraction executor and is bounded by GEMINI_REQUEST_TIMEOUT_SEC.
 * A timed-out attempt is cancelled and counts as a transient failure.
 *
 * Retry policy:
 * - transient ExtractionException: retried up to GEMINI_RETRY_MAX_ATTEMPTS attempts in total
 * - permanent ExtractionException: rethrown immediately
 * - any other exception: wrapped as a permanent invalid-response error
 *
 * Backoff before attempt n (n >= 2) is base * 2^(n-2): base, 2*base, 4*base, ...
 */
@Component
@Slf4j
public class ExtractionRetryExecutor {

    private final PipelineProperties properties;
    private final Sleeper sleeper;
    private final ExecutorService extractionExecutor;

    public ExtractionRetryExecutor(PipelineProperties properties,
                                   Sleeper sleeper,
                                   @Qualifier("extractionExecutor") ExecutorService extractionExecutor) {
        this.properties = properties;
        this.sleeper = sleeper;
        this.extractionExecutor = extractionExecutor;
    }

    /**
     * Run the call with timeout and retry.
     *
     * @param call the extraction call
     * @return the call's result from the first successful attempt
     * @throws ExtractionException permanent failure, or retries exhausted
     */
    public <T> T execute(Supplier<T> call) {
        int maxAttempts = Math.max(1, properties.getRetryMaxAttempts());
        ExtractionException lastFailure = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                Duration delay = backoffDelay(attempt);
                log.warn("Retrying extraction: attempt={}/{}, delayMs={}, lastError={}",
                        attempt, maxAttempts, delay.toMillis(), lastFailure.getErrorCode());
                pause(delay);
            }

            try {
                return runAttempt(call);
            } catch (ExtractionException e) {
                if (!e.isTransient()) {
                    log.error("Extraction failed permanently: attempt={}, errorCode={}, message={}",
                            attempt, e.getErrorCode(), e.getMessage());
                    throw e;
                }
                lastFailure = e;
            }
        }

        log.error("Extraction retries exhausted: attempts={}, lastError={}", maxAttempts, lastFailure.getErrorCode());
        throw ExtractionException.retriesExhausted(maxAttempts, lastFailure);
    }

    /**
     * Delay before the given attempt number.
     */
    Duration backoffDelay(int attempt) {
        long baseMs = properties.retryBaseDelay().toMillis();
        return Duration.ofMillis(baseMs * (1L << Math.min(attempt - 2, 20)));
    }

    private <T> T runAttempt(Supplier<T> call) {
        Future<T> future = extractionExecutor.submit(call::get);
        long timeoutMs = properties.requestTimeout().toMillis();
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw ExtractionException.timeout(properties.getRequestTimeoutSec());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ExtractionException extractionException) {
                throw extractionException;
            }
            throw ExtractionException.invalidResponse(String.valueOf(cause), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw ExtractionException.rejected("interrupted while waiting for extraction", e);
        }
    }

    private void pause(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ExtractionException.rejected("interrupted during retry backoff", e);
        }
    }
}
