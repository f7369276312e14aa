package com.egg.exception;

/**
 * Exception thrown by an extraction adapter.
 *
 * Transient failures (HTTP 408/429/500/502/503/504, I/O errors, timeouts) are retried
 * with exponential backoff by {@link com.egg.pipeline.ExtractionRetryExecutor}.
 * Everything else, including malformed model output, is permanent.
 */
public class ExtractionException extends PipelineException {

    private static final String STAGE = "extraction";

    public ExtractionException(String errorCode, boolean transientFailure, String message, Throwable cause) {
        super(STAGE, errorCode, transientFailure, message, cause);
    }

    public static ExtractionException rateLimited(Throwable cause) {
        return new ExtractionException(
                "RATE_LIMITED",
                true,
                "Extraction model rate limit exceeded.",
                cause
        );
    }

    public static ExtractionException unavailable(String detail, Throwable cause) {
        return new ExtractionException(
                "MODEL_UNAVAILABLE",
                true,
                String.format("Extraction model unavailable: %s", detail),
                cause
        );
    }

    /**
     * One attempt ran past the per-request timeout.
     *
     * @param timeoutSec the configured timeout
     * @return a transient ExtractionException
     */
    public static ExtractionException timeout(long timeoutSec) {
        return new ExtractionException(
                "API_TIMEOUT",
                true,
                String.format("Extraction request timed out after %d seconds.", timeoutSec),
                null
        );
    }

    public static ExtractionException rejected(String detail, Throwable cause) {
        return new ExtractionException(
                "MODEL_REJECTED",
                false,
                String.format("Extraction request rejected: %s", detail),
                cause
        );
    }

    public static ExtractionException invalidResponse(String detail, Throwable cause) {
        return new ExtractionException(
                "INVALID_JSON",
                false,
                String.format("Extraction model returned an unusable response: %s", detail),
                cause
        );
    }

    public static ExtractionException retriesExhausted(int attempts, ExtractionException last) {
        return new ExtractionException(
                "RETRIES_EXHAUSTED",
                false,
                String.format("Extraction failed after %d attempts: %s", attempts, last.getMessage()),
                last
        );
    }
}
