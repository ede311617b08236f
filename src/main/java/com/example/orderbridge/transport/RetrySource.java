package com.example.orderbridge.transport;

import java.time.Duration;
import java.util.List;

/**
 * Consumer side of the retry topic. Not thread safe; owned by the retry loop.
 */
public interface RetrySource extends AutoCloseable {

    String name();

    /**
     * Next batch of records, empty if nothing arrived within {@code timeout}.
     */
    List<LogRecord> poll(Duration timeout);

    /**
     * Commits the read position past every record returned so far.
     */
    void commit();

    /**
     * Moves the read position back to the last committed position so uncommitted
     * records are delivered again.
     */
    void rewind();

    @Override
    void close();
}
