package com.example.orderbridge.model;

/**
 * Result of a successful transformation: the output record, the key it is
 * forwarded under and its serialized JSON payload.
 */
public record TransformedOrder(
    OrderType type,
    String messageKey,
    CanonicalOrder output,
    String payload
) {}
