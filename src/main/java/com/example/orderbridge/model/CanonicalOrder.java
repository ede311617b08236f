package com.example.orderbridge.model;

/**
 * Output record forwarded to the destination transport.
 * Implementations are immutable and created only by the transformer.
 */
public interface CanonicalOrder {

    String status();

    int itemsCount();
}
