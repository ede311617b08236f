package com.example.orderbridge.transform;

/**
 * Raised when a raw message cannot be classified, validated or transformed.
 * Always recoverable from the bridge's point of view: the message goes to the retry topic.
 */
public class OrderTransformationException extends Exception {

    public OrderTransformationException(String reason) {
        super(reason);
    }

    public OrderTransformationException(String reason, Throwable cause) {
        super(reason, cause);
    }

    public String getReason() {
        return getMessage();
    }
}
