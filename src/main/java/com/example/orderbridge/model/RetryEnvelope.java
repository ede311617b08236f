package com.example.orderbridge.model;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.Objects;

/**
 * Retry metadata wrapped around an original message while it travels through the retry topic.
 * Serialized as a flat JSON object so other consumers of the topic can read it directly.
 *
 * <p>{@code retryCount} grows by exactly one per re-emission and
 * {@code firstAttemptTimestamp} is carried unchanged by {@link #nextAttempt}.
 */
public record RetryEnvelope(
    String originalMessage,
    String messageKey,
    int retryCount,
    Instant firstAttemptTimestamp,
    Instant lastAttemptTimestamp,
    String errorMessage,
    String errorDetail
) {

    public RetryEnvelope {
        Objects.requireNonNull(originalMessage, "originalMessage");
        Objects.requireNonNull(messageKey, "messageKey");
        Objects.requireNonNull(firstAttemptTimestamp, "firstAttemptTimestamp");
        Objects.requireNonNull(lastAttemptTimestamp, "lastAttemptTimestamp");
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be >= 0 but was " + retryCount);
        }
    }

    /**
     * Envelope for a message that failed its first transformation attempt.
     */
    public static RetryEnvelope firstFailure(String originalMessage, String messageKey, Throwable error, Instant now) {
        return new RetryEnvelope(originalMessage, messageKey, 0, now, now, error.getMessage(), stackTraceOf(error));
    }

    /**
     * Envelope to re-emit after another failed attempt.
     */
    public RetryEnvelope nextAttempt(Throwable error, Instant now) {
        return new RetryEnvelope(
                originalMessage,
                messageKey,
                retryCount + 1,
                firstAttemptTimestamp,
                now,
                error.getMessage(),
                stackTraceOf(error));
    }

    static String stackTraceOf(Throwable error) {
        StringWriter out = new StringWriter();
        error.printStackTrace(new PrintWriter(out));
        return out.toString();
    }
}
