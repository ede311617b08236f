package com.example.orderbridge.transform;

import com.example.orderbridge.model.OrderType;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Determines the variant of a decoded message.
 *
 * <p>The {@code orderType} discriminator wins when present. Without it the shape decides,
 * checked in fixed order: bulk, then priority, then standard.
 */
public class OrderClassifier {

    public static final String DISCRIMINATOR = "orderType";

    public OrderType classify(JsonNode root) {
        if (root == null || !root.isObject()) {
            return OrderType.UNKNOWN;
        }
        JsonNode discriminator = root.get(DISCRIMINATOR);
        if (discriminator != null && !discriminator.isNull()) {
            return discriminator.isTextual()
                    ? OrderType.fromDiscriminator(discriminator.asText())
                    : OrderType.UNKNOWN;
        }
        if (has(root, "batchId") && has(root, "orders")) {
            return OrderType.BULK;
        }
        if (has(root, "priorityLevel") && has(root, "expectedDeliveryDate")) {
            return OrderType.PRIORITY;
        }
        if (has(root, "orderId") && has(root, "items")) {
            return OrderType.STANDARD;
        }
        return OrderType.UNKNOWN;
    }

    private static boolean has(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node != null && !node.isNull();
    }
}
