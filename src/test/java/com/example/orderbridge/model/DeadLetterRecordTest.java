package com.example.orderbridge.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class DeadLetterRecordTest {

    private static final Instant FIRST = Instant.parse("2024-06-01T12:00:00Z");
    private static final Instant NOW = Instant.parse("2024-06-01T12:01:00Z");

    private final RetryEnvelope envelope =
            new RetryEnvelope("{\"orderId\":\"ORD-1\"}", "ORD-1", 3, FIRST, FIRST, "last error", "detail");

    @Test
    @DisplayName("Should carry envelope error when quarantining an exhausted envelope")
    void shouldBuildFromEnvelope() {
        DeadLetterRecord record = DeadLetterRecord.fromEnvelope(envelope, NOW);

        assertThat(record.originalMessage()).isEqualTo(envelope.originalMessage());
        assertThat(record.messageKey()).isEqualTo("ORD-1");
        assertThat(record.totalRetries()).isEqualTo(3);
        assertThat(record.firstAttemptTimestamp()).isEqualTo(FIRST);
        assertThat(record.failedTimestamp()).isEqualTo(NOW);
        assertThat(record.finalErrorMessage()).isEqualTo("last error");
        assertThat(record.finalErrorDetail()).isEqualTo("detail");
    }

    @Test
    @DisplayName("Should default error message when envelope has none")
    void shouldDefaultErrorMessage() {
        RetryEnvelope withoutError = new RetryEnvelope("{}", "ORD-2", 5, FIRST, FIRST, null, null);

        assertThat(DeadLetterRecord.fromEnvelope(withoutError, NOW).finalErrorMessage())
                .isEqualTo("Max retries exceeded");
    }

    @Test
    @DisplayName("Should record final error and total retries after last failed attempt")
    void shouldBuildExhausted() {
        DeadLetterRecord record = DeadLetterRecord.exhausted(envelope, 3, new IllegalStateException("final"), NOW);

        assertThat(record.totalRetries()).isEqualTo(3);
        assertThat(record.finalErrorMessage()).isEqualTo("final");
        assertThat(record.finalErrorDetail()).contains("IllegalStateException");
        assertThat(record.firstAttemptTimestamp()).isEqualTo(FIRST);
    }

    @Test
    @DisplayName("Should keep raw text of unreadable envelope")
    void shouldBuildUnreadable() {
        DeadLetterRecord record = DeadLetterRecord.unreadable("garbage", "ORD-3", new IllegalArgumentException("bad"), NOW);

        assertThat(record.originalMessage()).isEqualTo("garbage");
        assertThat(record.totalRetries()).isZero();
        assertThat(record.finalErrorMessage()).isEqualTo("Unreadable retry envelope: bad");
        assertThat(record.failedTimestamp()).isEqualTo(NOW);
    }
}
