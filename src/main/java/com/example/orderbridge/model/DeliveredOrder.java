package com.example.orderbridge.model;

import java.time.Instant;

/**
 * Priority order marked delivered.
 */
public record DeliveredOrder(
    String orderId,
    int itemsCount,
    String status,
    Instant deliveredAt,
    String deliveryLocation
) implements CanonicalOrder {

    public static final String STATUS = "DELIVERED";

    // Placeholder until the logistics system lookup exists
    public static final String DEFAULT_DELIVERY_LOCATION = "Delivery location from logistics system";

    public static DeliveredOrder of(PriorityOrder order, Instant now) {
        return new DeliveredOrder(order.orderId(), order.items().size(), STATUS, now, DEFAULT_DELIVERY_LOCATION);
    }
}
