package com.example.orderbridge.config;

import java.util.Locale;

/**
 * Which transport plays the source role. Retry and dead-letter topics are Kafka in both cases.
 */
public enum BridgeDirection {
    /** IBM MQ queue in, Kafka topic out. */
    QUEUE_TO_LOG,
    /** Kafka topic in, IBM MQ queue out. */
    LOG_TO_QUEUE;

    /**
     * Accepts {@code queue-to-log} / {@code log-to-queue} as well as the constant names.
     */
    public static BridgeDirection parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("app.bridge.direction must not be blank");
        }
        String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Unsupported app.bridge.direction '" + value
                    + "', expected queue-to-log or log-to-queue", e);
        }
    }
}
