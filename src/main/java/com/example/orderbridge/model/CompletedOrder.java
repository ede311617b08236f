package com.example.orderbridge.model;

import java.time.Instant;

/**
 * Bulk batch marked completed.
 */
public record CompletedOrder(
    String batchId,
    int itemsCount,
    String status,
    Instant completedAt,
    boolean customerConfirmation
) implements CanonicalOrder {

    public static final String STATUS = "COMPLETED";

    public static CompletedOrder of(BulkOrder order, Instant now) {
        return new CompletedOrder(order.batchId(), order.itemsCount(), STATUS, now, true);
    }
}
