package com.example.orderbridge.transport.kafka;

import com.example.orderbridge.transport.LogRecord;
import com.example.orderbridge.transport.RetrySource;
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
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Reads retry envelopes from the retry topic with manual offset commits.
 *
 * <p>KafkaConsumer is not thread safe: every call goes through {@link #lock}. The consumer is
 * created and subscribed on first use.
 */
@Slf4j
public class KafkaRetrySource implements RetrySource {

    private final Supplier<Consumer<String, String>> consumerSupplier;
    private final String topic;
    private final ReentrantLock lock = new ReentrantLock();

    private Consumer<String, String> consumer;

    public KafkaRetrySource(Supplier<Consumer<String, String>> consumerSupplier, String topic) {
        this.consumerSupplier = consumerSupplier;
        this.topic = topic;
    }

    @Override
    public String name() {
        return topic;
    }

    @Override
    public List<LogRecord> poll(Duration timeout) {
        lock.lock();
        try {
            ConsumerRecords<String, String> records = consumer().poll(timeout);
            List<LogRecord> result = new ArrayList<>(records.count());
            for (ConsumerRecord<String, String> record : records) {
                result.add(new LogRecord(record.key(), record.value(), KafkaPositions.describe(record)));
            }
            return result;
        } catch (KafkaException e) {
            throw new TransportException(topic, "Failed to poll retry topic", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void commit() {
        lock.lock();
        try {
            consumer().commitSync();
        } catch (KafkaException e) {
            throw new TransportException(topic, "Failed to commit retry topic offsets", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void rewind() {
        lock.lock();
        try {
            if (consumer == null) {
                return;
            }
            Set<TopicPartition> assignment = consumer.assignment();
            if (assignment.isEmpty()) {
                return;
            }
            Map<TopicPartition, OffsetAndMetadata> committed = consumer.committed(assignment);
            for (TopicPartition partition : assignment) {
                OffsetAndMetadata offset = committed.get(partition);
                if (offset != null) {
                    consumer.seek(partition, offset.offset());
                } else {
                    consumer.seekToBeginning(List.of(partition));
                }
            }
            log.warn("Rewound {} partition(s) of {} to last committed offsets", assignment.size(), topic);
        } catch (KafkaException e) {
            throw new TransportException(topic, "Failed to rewind retry topic", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (consumer != null) {
                log.info("Closing retry topic consumer for {}", topic);
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
            log.info("Subscribed to retry topic {}", topic);
        }
        return consumer;
    }
}
