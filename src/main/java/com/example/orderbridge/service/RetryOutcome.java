package com.example.orderbridge.service;

/**
 * Terminal state of one retry envelope in the retry loop.
 */
public enum RetryOutcome {
    FORWARDED,
    REQUEUED,
    DEAD_LETTERED
}
