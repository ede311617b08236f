package com.example.orderbridge.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff between retry attempts: {@code min(base * 2^attempt, cap)}.
 * The exponent is capped at {@value #MAX_EXPONENT} before shifting so the multiplication cannot overflow.
 */
public final class BackoffPolicy {

    static final int MAX_EXPONENT = 5;

    private final Duration baseDelay;
    private final Duration capDelay;

    public BackoffPolicy(Duration baseDelay, Duration capDelay) {
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(capDelay, "capDelay");
        if (baseDelay.isNegative() || capDelay.isNegative()) {
            throw new IllegalArgumentException("Backoff delays must not be negative");
        }
        if (capDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("capDelay " + capDelay + " is shorter than baseDelay " + baseDelay);
        }
        this.baseDelay = baseDelay;
        this.capDelay = capDelay;
    }

    /**
     * 1s, 2s, 4s, 8s, 16s then 30s for every later attempt.
     */
    public static BackoffPolicy defaults() {
        return new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(30));
    }

    /**
     * Wait before reattempting a message that has already been retried {@code attempt} times.
     */
    public Duration delay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0 but was " + attempt);
        }
        Duration exponential = baseDelay.multipliedBy(1L << Math.min(attempt, MAX_EXPONENT));
        return exponential.compareTo(capDelay) > 0 ? capDelay : exponential;
    }

    public Duration baseDelay() {
        return baseDelay;
    }

    public Duration capDelay() {
        return capDelay;
    }

    @Override
    public String toString() {
        return "BackoffPolicy[base=" + baseDelay + ", cap=" + capDelay + "]";
    }
}
