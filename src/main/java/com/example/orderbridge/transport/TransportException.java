package com.example.orderbridge.transport;

import lombok.Getter;

/**
 * Failure talking to a queue or topic. Unchecked: it aborts the current batch and is handled
 * at the loop boundary.
 */
@Getter
public class TransportException extends RuntimeException {

    private final String destination;

    public TransportException(String destination, String message, Throwable cause) {
        super(message + " [" + destination + "]", cause);
        this.destination = destination;
    }
}
