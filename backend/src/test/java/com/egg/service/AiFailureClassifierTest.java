package com.egg.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AiFailureClassifier Unit Tests")
class AiFailureClassifierTest {

    @Test
    @DisplayName("retryable status codes should be transient")
    void testIsTransient_RetryableStatus() {
        for (int status : new int[]{408, 429, 500, 502, 503, 504}) {
            assertTrue(AiFailureClassifier.isTransient(new NonTransientAiException(status + " - error")),
                    "status " + status);
        }
    }

    @Test
    @DisplayName("other status codes should be permanent even on a transient exception type")
    void testIsTransient_PermanentStatus() {
        assertFalse(AiFailureClassifier.isTransient(new NonTransientAiException("400 - bad request")));
        assertFalse(AiFailureClassifier.isTransient(new TransientAiException("501 - not implemented")));
        assertFalse(AiFailureClassifier.isTransient(new NonTransientAiException("401 - unauthorized")));
    }

    @Test
    @DisplayName("I/O errors and timeouts anywhere in the cause chain should be transient")
    void testIsTransient_CauseChain() {
        assertTrue(AiFailureClassifier.isTransient(new RuntimeException(new SocketTimeoutException("read"))));
        assertTrue(AiFailureClassifier.isTransient(new IllegalStateException(new IOException("reset"))));
        assertTrue(AiFailureClassifier.isTransient(new TimeoutException()));
        assertFalse(AiFailureClassifier.isTransient(new IllegalArgumentException("bad input")));
    }

    @Test
    @DisplayName("httpStatus should read the leading status of Spring AI errors only")
    void testHttpStatus() {
        assertEquals(429, AiFailureClassifier.httpStatus(new NonTransientAiException("429 - quota")));
        assertNull(AiFailureClassifier.httpStatus(new NonTransientAiException("quota exceeded")));
        assertNull(AiFailureClassifier.httpStatus(new RuntimeException("503 - unavailable")));
    }
}
