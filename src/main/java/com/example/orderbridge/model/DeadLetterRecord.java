package com.example.orderbridge.model;

import java.time.Instant;

/**
 * Terminal record for a message that exhausted its retries. Written once to the dead-letter topic.
 */
public record DeadLetterRecord(
    String originalMessage,
    String messageKey,
    int totalRetries,
    Instant firstAttemptTimestamp,
    Instant failedTimestamp,
    String finalErrorMessage,
    String finalErrorDetail
) {

    static final String MAX_RETRIES_EXCEEDED = "Max retries exceeded";

    /**
     * Quarantines an envelope that already reached the retry limit when it was dequeued.
     */
    public static DeadLetterRecord fromEnvelope(RetryEnvelope envelope, Instant now) {
        return new DeadLetterRecord(
                envelope.originalMessage(),
                envelope.messageKey(),
                envelope.retryCount(),
                envelope.firstAttemptTimestamp(),
                now,
                envelope.errorMessage() != null ? envelope.errorMessage() : MAX_RETRIES_EXCEEDED,
                envelope.errorDetail());
    }

    /**
     * Quarantines an envelope whose last permitted reattempt failed with {@code error}.
     */
    public static DeadLetterRecord exhausted(RetryEnvelope envelope, int totalRetries, Throwable error, Instant now) {
        return new DeadLetterRecord(
                envelope.originalMessage(),
                envelope.messageKey(),
                totalRetries,
                envelope.firstAttemptTimestamp(),
                now,
                error.getMessage(),
                RetryEnvelope.stackTraceOf(error));
    }

    /**
     * Quarantines a retry topic record that could not be read as an envelope.
     */
    public static DeadLetterRecord unreadable(String rawRecord, String messageKey, Throwable error, Instant now) {
        return new DeadLetterRecord(
                rawRecord,
                messageKey,
                0,
                now,
                now,
                "Unreadable retry envelope: " + error.getMessage(),
                RetryEnvelope.stackTraceOf(error));
    }
}
