package com.example.orderbridge.service;

import com.example.orderbridge.model.DeadLetterRecord;
import com.example.orderbridge.model.RetryEnvelope;
import com.example.orderbridge.support.BridgeHarness;
import com.example.orderbridge.support.RecordingSink.Sent;
import com.example.orderbridge.transform.FaultInjectionPolicy;
import com.example.orderbridge.transform.PrefixFaultInjectionPolicy;
import com.example.orderbridge.transport.LogRecord;
import com.example.orderbridge.transport.TransportException;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

import static com.example.orderbridge.support.OrderFixtures.standard;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * End-to-end scenarios: both orchestrators against in-memory transports.
 */
class BridgeScenarioTest {

    private static final List<String> FAIL_ONCE = List.of("ORD-RETRY-");
    private static final List<String> ALWAYS_FAIL = List.of("ORD-DLQ-");

    private List<RetryEnvelope> envelopes(BridgeHarness harness) throws Exception {
        List<RetryEnvelope> result = new ArrayList<>();
        for (LogRecord record : harness.retryTopic.records()) {
            result.add(harness.objectMapper.readValue(record.value(), RetryEnvelope.class));
        }
        return result;
    }

    @Test
    @DisplayName("Scenario A: standard order is forwarded once with item count and processing timestamp")
    void standardOrderIsForwarded() throws Exception {
        // Given
        BridgeHarness harness = new BridgeHarness(FaultInjectionPolicy.NONE, 3);
        harness.source.put(standard("ORD-1"));

        // When
        harness.runUntilQuiet();

        // Then
        assertThat(harness.destination.sent()).hasSize(1);
        Sent sent = harness.destination.sent().get(0);
        assertThat(sent.key()).isEqualTo("ORD-1");
        JsonNode output = harness.objectMapper.readTree(sent.payload());
        assertThat(output.get("itemsCount").asInt()).isEqualTo(2);
        assertThat(output.get("status").asText()).isEqualTo("WIP");
        assertThat(Instant.parse(output.get("processingStartedAt").asText()))
                .isCloseTo(Instant.now(), within(5, ChronoUnit.SECONDS));

        assertThat(harness.retryTopic.records()).isEmpty();
        assertThat(harness.deadLetters.sent()).isEmpty();
        assertThat(harness.source.pending()).isZero();
    }

    @Test
    @DisplayName("Scenario B: message failing once is forwarded once after one retry cycle")
    void failOnceMessageRecovers() throws Exception {
        // Given
        BridgeHarness harness = new BridgeHarness(new PrefixFaultInjectionPolicy(FAIL_ONCE, List.of()), 3);
        harness.source.put(standard("ORD-RETRY-1"));

        // When
        harness.runUntilQuiet();

        // Then
        assertThat(harness.destination.sent()).extracting(Sent::key).containsExactly("ORD-RETRY-1");
        assertThat(harness.deadLetters.sent()).isEmpty();
        assertThat(envelopes(harness)).singleElement()
                .satisfies(envelope -> {
                    assertThat(envelope.retryCount()).isZero();
                    assertThat(envelope.messageKey()).isEqualTo("ORD-RETRY-1");
                });
        assertThat(harness.retryTopic.lag()).isZero();
    }

    @Test
    @DisplayName("Scenario C: message failing every attempt is dead-lettered after three retries")
    void alwaysFailingMessageIsDeadLettered() throws Exception {
        // Given
        BridgeHarness harness = new BridgeHarness(new PrefixFaultInjectionPolicy(List.of(), ALWAYS_FAIL), 3);
        harness.source.put(standard("ORD-DLQ-1"));

        // When
        harness.runUntilQuiet();

        // Then
        assertThat(harness.destination.sent()).isEmpty();
        List<RetryEnvelope> envelopes = envelopes(harness);
        assertThat(envelopes).extracting(RetryEnvelope::retryCount).containsExactly(0, 1, 2);
        Instant first = envelopes.get(0).firstAttemptTimestamp();
        assertThat(envelopes).allSatisfy(envelope -> assertThat(envelope.firstAttemptTimestamp()).isEqualTo(first));

        assertThat(harness.deadLetters.sent()).hasSize(1);
        Sent sent = harness.deadLetters.sent().get(0);
        assertThat(sent.key()).isEqualTo("ORD-DLQ-1");
        DeadLetterRecord deadLetter = harness.objectMapper.readValue(sent.payload(), DeadLetterRecord.class);
        assertThat(deadLetter.totalRetries()).isEqualTo(3);
        assertThat(deadLetter.originalMessage()).isEqualTo(standard("ORD-DLQ-1"));
        assertThat(deadLetter.firstAttemptTimestamp()).isEqualTo(first);
        assertThat(deadLetter.failedTimestamp()).isAfterOrEqualTo(first);
        assertThat(deadLetter.finalErrorMessage()).isEqualTo("Simulated transformation failure for ORD-DLQ-1");
    }

    @Test
    @DisplayName("Scenario D: structurally invalid messages are never forwarded")
    void invalidMessagesAreNeverForwarded() throws Exception {
        // Given
        BridgeHarness harness = new BridgeHarness(FaultInjectionPolicy.NONE, 3);
        harness.source.put(standard("ORD-X").replace("\"orderId\"", "\"orderType\": \"EXPRESS\", \"orderId\""));
        harness.source.put("{\"foo\": \"bar\"}");
        harness.source.put("not json at all");

        // When
        harness.runUntilQuiet();

        // Then
        assertThat(harness.destination.sent()).isEmpty();
        assertThat(harness.deadLetters.sent()).hasSize(3);
        assertThat(harness.source.pending()).isZero();
    }

    @Test
    @DisplayName("Should redeliver and forward every message after a destination outage")
    void redeliversAfterDestinationOutage() throws Exception {
        // Given
        BridgeHarness harness = new BridgeHarness(FaultInjectionPolicy.NONE, 3);
        harness.source.put(standard("ORD-1"));
        harness.source.put(standard("ORD-2"));
        harness.destination.failNext(1);

        // When - first batch aborts, everything is released
        assertThatThrownBy(harness.ingest::processBatch).isInstanceOf(TransportException.class);
        assertThat(harness.source.pending()).isEqualTo(2);
        harness.runUntilQuiet();

        // Then
        assertThat(harness.destination.sent()).extracting(Sent::key).containsExactly("ORD-1", "ORD-2");
        assertThat(harness.source.acknowledged()).hasSize(2);
    }
}
