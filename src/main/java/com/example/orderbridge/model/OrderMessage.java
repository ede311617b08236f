package com.example.orderbridge.model;

/**
 * Validated input message, one implementation per {@link OrderType} variant.
 */
public interface OrderMessage {

    OrderType type();

    /**
     * Stable key used for partitioning on every transport the message touches.
     */
    String messageKey();
}
