package com.example.orderbridge.transport;

/**
 * Message received from the source transport.
 *
 * @param messageId transport-assigned id, used as the acknowledgement handle
 * @param body raw payload text, empty when the transport delivered no body
 */
public record SourceMessage(
    String messageId,
    String body
) {
    public SourceMessage {
        body = body != null ? body : "";
    }
}
