package com.example.orderbridge.transport.kafka;

import com.example.orderbridge.transport.MessageSink;
import com.example.orderbridge.transport.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends payloads to a Kafka topic and waits for the broker acknowledgement ({@code acks=all}).
 * The {@link KafkaTemplate} is thread safe and shared by every sink.
 */
@Slf4j
public class KafkaTopicSink implements MessageSink {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final String topic;
    private final Duration sendTimeout;

    public KafkaTopicSink(KafkaTemplate<String, String> kafkaTemplate, String topic, Duration sendTimeout) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic = topic;
        this.sendTimeout = sendTimeout;
    }

    @Override
    public String name() {
        return topic;
    }

    @Override
    public void send(String key, String payload) {
        try {
            SendResult<String, String> result = kafkaTemplate.send(topic, key, payload)
                    .get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
            RecordMetadata metadata = result.getRecordMetadata();
            log.info("Message sent to Kafka - Topic: {}, Partition: {}, Offset: {}, Key: {}",
                    metadata.topic(), metadata.partition(), metadata.offset(), key);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(topic, "Interrupted while sending message with key " + key, e);
        } catch (ExecutionException e) {
            throw new TransportException(topic, "Failed to send message with key " + key, e.getCause());
        } catch (TimeoutException e) {
            throw new TransportException(topic, "No acknowledgement within " + sendTimeout + " for key " + key, e);
        }
    }
}
