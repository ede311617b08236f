package com.example.orderbridge.transport;

/**
 * Record read from a partitioned log.
 *
 * @param key partition key, may be null
 * @param value record payload
 * @param position {@code topic-partition@offset}, for logging
 */
public record LogRecord(
    String key,
    String value,
    String position
) {}
