package com.phillippitts.scriptorium.exception;

import java.time.Duration;

/**
 * Thrown when a rate-limited operation (OCR, review acceptance) is attempted too often.
 * Retryable later; never retried automatically.
 */
public class RateLimitedException extends ScriptoriumException {

    private final String operation;
    private final Duration retryAfter;

    public RateLimitedException(String operation, Duration retryAfter) {
        super("Rate limit exceeded for " + operation + "; retry after " + retryAfter.toSeconds() + "s");
        this.operation = operation;
        this.retryAfter = retryAfter;
    }

    public String getOperation() {
        return operation;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
