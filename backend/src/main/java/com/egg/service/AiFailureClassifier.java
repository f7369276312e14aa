package com.egg.service;

import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.web.client.ResourceAccessException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.Set;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether a provider failure is worth retrying.
 *
 * Spring AI reports HTTP errors as "{status} - {body}": 4xx as NonTransientAiException,
 * 5xx as TransientAiException. Status codes 408, 429, 500, 502, 503 and 504 are
 * retryable, as are I/O errors and timeouts. Everything else is permanent.
 */
public final class AiFailureClassifier {

    private static final Set<Integer> RETRYABLE_STATUS = Set.of(408, 429, 500, 502, 503, 504);
    private static final Pattern LEADING_STATUS = Pattern.compile("^\\s*(\\d{3})\\b");

    private AiFailureClassifier() {
    }

    public static boolean isTransient(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            Integer status = httpStatus(current);
            if (status != null) {
                return RETRYABLE_STATUS.contains(status);
            }
            if (current instanceof TransientAiException
                    || current instanceof ResourceAccessException
                    || current instanceof SocketTimeoutException
                    || current instanceof TimeoutException
                    || current instanceof IOException) {
                return true;
            }
            if (current instanceof NonTransientAiException) {
                return false;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }

    /**
     * HTTP status code carried by the error message, if any.
     */
    public static Integer httpStatus(Throwable error) {
        if (!(error instanceof TransientAiException) && !(error instanceof NonTransientAiException)) {
            return null;
        }
        String message = error.getMessage();
        if (message == null) {
            return null;
        }
        Matcher matcher = LEADING_STATUS.matcher(message);
        return matcher.find() ? Integer.valueOf(matcher.group(1)) : null;
    }
}
