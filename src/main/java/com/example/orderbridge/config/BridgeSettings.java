package com.example.orderbridge.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Bridge configuration, read once at startup and immutable afterwards.
 * Construction fails fast on invalid values so no loop ever starts with a broken configuration.
 */
public record BridgeSettings(
    BridgeDirection direction,
    String source,
    String destination,
    String retryTopic,
    String dlqTopic,
    int maxRetries,
    int batchSize,
    Duration receiveWait,
    Duration retryPollTimeout,
    Duration errorBackoff,
    Duration sendTimeout,
    Duration shutdownTimeout,
    Duration backoffBase,
    Duration backoffCap
) {

    public BridgeSettings {
        List<String> problems = new ArrayList<>();
        if (direction == null) {
            problems.add("direction is required");
        }
        requireName(problems, "source", source);
        requireName(problems, "destination", destination);
        requireName(problems, "retry-topic", retryTopic);
        requireName(problems, "dlq-topic", dlqTopic);
        if (maxRetries < 1) {
            problems.add("max-retries must be >= 1 but was " + maxRetries);
        }
        if (batchSize < 1) {
            problems.add("batch-size must be >= 1 but was " + batchSize);
        }
        requirePositive(problems, "receive-wait", receiveWait, true);
        requirePositive(problems, "retry-poll-timeout", retryPollTimeout, false);
        requirePositive(problems, "error-backoff", errorBackoff, true);
        requirePositive(problems, "send-timeout", sendTimeout, false);
        requirePositive(problems, "shutdown-timeout", shutdownTimeout, false);
        requirePositive(problems, "backoff.base", backoffBase, true);
        requirePositive(problems, "backoff.cap", backoffCap, true);
        if (backoffBase != null && backoffCap != null && backoffCap.compareTo(backoffBase) < 0) {
            problems.add("backoff.cap must not be shorter than backoff.base");
        }
        if (retryTopic != null && retryTopic.equals(dlqTopic)) {
            problems.add("retry-topic and dlq-topic must differ");
        }
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Invalid app.bridge configuration: " + String.join("; ", problems));
        }
    }

    private static void requireName(List<String> problems, String property, String value) {
        if (value == null || value.isBlank()) {
            problems.add(property + " must not be blank");
        }
    }

    private static void requirePositive(List<String> problems, String property, Duration value, boolean zeroAllowed) {
        if (value == null) {
            problems.add(property + " is required");
        } else if (value.isNegative() || (!zeroAllowed && value.isZero())) {
            problems.add(property + " must be " + (zeroAllowed ? ">= 0" : "> 0") + " but was " + value);
        }
    }
}
