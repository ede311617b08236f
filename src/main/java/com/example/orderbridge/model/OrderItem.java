package com.example.orderbridge.model;

import java.math.BigDecimal;

/**
 * Single line item of an order.
 */
public record OrderItem(
    String productId,
    int quantity,
    BigDecimal price
) {}
