package com.example.orderbridge.transport.kafka;

import com.example.orderbridge.transport.SourceMessage;
import com.example.orderbridge.transport.SourceQueue;
import com.example.orderbridge.transport.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Kafka topic used as the source side of the bridge (log-to-queue deployments).
 *
 * <p>Acknowledging a record commits the offset right after it. Releasing seeks every partition
 * back to its earliest unacknowledged record so the next receive returns it again.
 * Consumer calls are serialized by a lock.
 */
@Slf4j
public class KafkaSourceQueue implements SourceQueue {

    private final Supplier<Consumer<String, String>> consumerSupplier;
    private final String topic;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, PendingRecord> inFlight = new LinkedHashMap<>();

    private Consumer<String, String> consumer;

    public KafkaSourceQueue(Supplier<Consumer<String, String>> consumerSupplier, String topic) {
        this.consumerSupplier = consumerSupplier;
        this.topic = topic;
    }

    @Override
    public String name() {
        return topic;
    }

    @Override
    public List<SourceMessage> receive(int maxMessages, Duration waitTimeout) {
        lock.lock();
        try {
            ConsumerRecords<String, String> records = consumer().poll(waitTimeout);
            List<SourceMessage> messages = new ArrayList<>();
            Map<TopicPartition, Long> notReturned = new HashMap<>();
            for (ConsumerRecord<String, String> record : records) {
                TopicPartition partition = new TopicPartition(record.topic(), record.partition());
                if (messages.size() >= maxMessages) {
                    notReturned.merge(partition, record.offset(), Math::min);
                    continue;
                }
                String messageId = KafkaPositions.describe(record);
                inFlight.put(messageId, new PendingRecord(partition, record.offset()));
                messages.add(new SourceMessage(messageId, record.value()));
            }
            notReturned.forEach(consumer::seek);
            return messages;
        } catch (KafkaException e) {
            throw new TransportException(topic, "Failed to poll source topic", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void ack(SourceMessage message) {
        lock.lock();
        try {
            PendingRecord pending = inFlight.remove(message.messageId());
            if (pending == null) {
                log.warn("Ignoring ack for record {} which is not in flight", message.messageId());
                return;
            }
            consumer().commitSync(Map.of(pending.partition(), new OffsetAndMetadata(pending.offset() + 1)));
        } catch (KafkaException e) {
            throw new TransportException(topic, "Failed to commit offset for " + message.messageId(), e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void release() {
        lock.lock();
        try {
            if (inFlight.isEmpty()) {
                return;
            }
            Map<TopicPartition, Long> earliest = new HashMap<>();
            inFlight.values().forEach(pending -> earliest.merge(pending.partition(), pending.offset(), Math::min));
            earliest.forEach(consumer()::seek);
            log.warn("Released {} unacknowledged record(s) on {} for redelivery", inFlight.size(), topic);
            inFlight.clear();
        } catch (KafkaException e) {
            throw new TransportException(topic, "Failed to seek back to unacknowledged records", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            inFlight.clear();
            if (consumer != null) {
                log.info("Closing source topic consumer for {}", topic);
                consumer.close();
                consumer = null;
            }
        } finally {
            lock.unlock();
        }
    }

    private Consumer<String, String> consumer() {
        if (consumer == null) {
            consumer = consumerSupplier.get();
            consumer.subscribe(List.of(topic));
            log.info("Subscribed to source topic {}", topic);
        }
        return consumer;
    }

    private record PendingRecord(TopicPartition partition, long offset) {}
}
