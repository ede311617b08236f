package com.example.orderbridge.transport.kafka;

import com.example.orderbridge.transport.TransportException;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KafkaTopicSinkTest {

    private static final String TOPIC = "place-order-topic";

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    private KafkaTopicSink sink;

    @BeforeEach
    void setUp() {
        sink = new KafkaTopicSink(kafkaTemplate, TOPIC, Duration.ofMillis(50));
    }

    @Test
    @DisplayName("Should send keyed record and wait for acknowledgement")
    void shouldSendKeyedRecord() {
        // Given
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 41L, 0, 0L, 5, 10);
        SendResult<String, String> result = new SendResult<>(new ProducerRecord<>(TOPIC, "ORD-1", "{}"), metadata);
        when(kafkaTemplate.send(TOPIC, "ORD-1", "{}")).thenReturn(CompletableFuture.completedFuture(result));

        // When / Then
        assertThatCode(() -> sink.send("ORD-1", "{}")).doesNotThrowAnyException();
        verify(kafkaTemplate).send(TOPIC, "ORD-1", "{}");
    }

    @Test
    @DisplayName("Should wrap failed send with the broker cause")
    void shouldWrapFailedSend() {
        // Given
        when(kafkaTemplate.send(TOPIC, "ORD-2", "{}"))
                .thenReturn(CompletableFuture.failedFuture(new KafkaException("not enough replicas")));

        // Then
        assertThatThrownBy(() -> sink.send("ORD-2", "{}"))
                .isInstanceOf(TransportException.class)
                .hasMessageContaining(TOPIC)
                .hasCauseInstanceOf(KafkaException.class);
    }

    @Test
    @DisplayName("Should fail when no acknowledgement arrives in time")
    void shouldTimeOut() {
        // Given
        when(kafkaTemplate.send(TOPIC, "ORD-3", "{}")).thenReturn(new CompletableFuture<>());

        // Then
        assertThatThrownBy(() -> sink.send("ORD-3", "{}"))
                .isInstanceOf(TransportException.class)
                .hasCauseInstanceOf(TimeoutException.class);
    }
}
