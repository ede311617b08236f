package com.example.orderbridge.transport.kafka;

import org.apache.kafka.clients.consumer.ConsumerRecord;

final class KafkaPositions {

    private KafkaPositions() {}

    static String describe(ConsumerRecord<?, ?> record) {
        return record.topic() + "-" + record.partition() + "@" + record.offset();
    }
}
