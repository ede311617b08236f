package com.example.orderbridge.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * One order inside a bulk batch.
 */
public record BulkOrderEntry(
    String orderId,
    List<OrderItem> items,
    BigDecimal totalAmount
) {
    public BulkOrderEntry {
        items = List.copyOf(items);
    }
}
