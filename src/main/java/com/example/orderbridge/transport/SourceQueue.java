package com.example.orderbridge.transport;

import java.time.Duration;
import java.util.List;

/**
 * Pull-based source of raw messages. Not thread safe; owned by a single loop.
 *
 * <p>Messages returned by {@link #receive} stay in flight until acknowledged. Anything not
 * acknowledged when {@link #release} is called is handed back to the transport for redelivery.
 */
public interface SourceQueue extends AutoCloseable {

    /**
     * Queue or topic name, for logging.
     */
    String name();

    /**
     * Blocks up to {@code waitTimeout} for the first message, then returns whatever is
     * immediately available, up to {@code maxMessages}. Empty when nothing arrived.
     */
    List<SourceMessage> receive(int maxMessages, Duration waitTimeout);

    /**
     * Marks a message as fully handled; it will not be redelivered.
     */
    void ack(SourceMessage message);

    /**
     * Returns every received but unacknowledged message to the transport.
     */
    void release();

    @Override
    void close();
}
