package com.example.orderbridge.transform;

/**
 * Decides whether a transformation attempt for a message key should fail on purpose.
 * Used to exercise the retry and dead-letter paths in test environments.
 */
@FunctionalInterface
public interface FaultInjectionPolicy {

    FaultInjectionPolicy NONE = messageKey -> false;

    /**
     * Called once per transformation attempt.
     */
    boolean shouldFail(String messageKey);
}
