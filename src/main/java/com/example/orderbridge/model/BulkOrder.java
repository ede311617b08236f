package com.example.orderbridge.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Batch of orders submitted together. {@code totalOrderCount} is client supplied
 * and is carried for reference only; counts are always derived from {@link #orders()}.
 */
public record BulkOrder(
    String batchId,
    String customerId,
    List<BulkOrderEntry> orders,
    int totalOrderCount,
    BigDecimal batchTotalAmount,
    String orderDate
) implements OrderMessage {

    public BulkOrder {
        orders = List.copyOf(orders);
    }

    /**
     * Items across every order of the batch.
     */
    public int itemsCount() {
        return orders.stream().mapToInt(order -> order.items().size()).sum();
    }

    @Override
    public OrderType type() {
        return OrderType.BULK;
    }

    @Override
    public String messageKey() {
        return batchId;
    }
}
