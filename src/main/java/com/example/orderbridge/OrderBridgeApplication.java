package com.example.orderbridge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Order Bridge Application.
 *
 * Moves order messages between an IBM MQ queue and a Kafka topic, transforming each into its
 * canonical form. Failures go through a Kafka retry topic with backoff and end on a
 * dead-letter topic once retries are exhausted.
 */
@SpringBootApplication
public class OrderBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrderBridgeApplication.class, args);
    }
}
