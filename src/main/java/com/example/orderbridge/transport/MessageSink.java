package com.example.orderbridge.transport;

/**
 * Keyed, append-only destination (topic or queue).
 */
public interface MessageSink {

    /**
     * Topic or queue name, for logging.
     */
    String name();

    /**
     * Sends a payload and blocks until the transport confirms it.
     *
     * @throws TransportException if the send fails or is not confirmed in time
     */
    void send(String key, String payload);
}
