package com.example.orderbridge.model;

import java.math.BigDecimal;
import java.util.List;

public record PriorityOrder(
    String orderId,
    String customerId,
    List<OrderItem> items,
    BigDecimal totalAmount,
    String orderDate,
    String priorityLevel,
    String expectedDeliveryDate
) implements OrderMessage {

    public PriorityOrder {
        items = List.copyOf(items);
    }

    @Override
    public OrderType type() {
        return OrderType.PRIORITY;
    }

    @Override
    public String messageKey() {
        return orderId;
    }
}
