package com.example.orderbridge.model;

import java.math.BigDecimal;
import java.util.List;

public record StandardOrder(
    String orderId,
    String customerId,
    List<OrderItem> items,
    BigDecimal totalAmount,
    String orderDate
) implements OrderMessage {

    public StandardOrder {
        items = List.copyOf(items);
    }

    @Override
    public OrderType type() {
        return OrderType.STANDARD;
    }

    @Override
    public String messageKey() {
        return orderId;
    }
}
