package com.example.orderbridge.model;

import java.util.Locale;

/**
 * Order variants recognised on the source transport.
 * UNKNOWN is never forwarded downstream.
 */
public enum OrderType {
    STANDARD,
    PRIORITY,
    BULK,
    UNKNOWN;

    /**
     * Resolves a discriminator value, ignoring case. Anything that is not a known
     * variant name (including "UNKNOWN" itself) resolves to UNKNOWN.
     */
    public static OrderType fromDiscriminator(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String name = value.trim().toUpperCase(Locale.ROOT);
        for (OrderType type : values()) {
            if (type != UNKNOWN && type.name().equals(name)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
