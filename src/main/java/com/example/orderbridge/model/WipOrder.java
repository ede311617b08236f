package com.example.orderbridge.model;

import java.time.Instant;

/**
 * Standard order accepted for processing.
 */
public record WipOrder(
    String orderId,
    int itemsCount,
    String status,
    Instant processingStartedAt
) implements CanonicalOrder {

    public static final String STATUS = "WIP";

    public static WipOrder of(StandardOrder order, Instant now) {
        return new WipOrder(order.orderId(), order.items().size(), STATUS, now);
    }
}
