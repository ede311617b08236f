package com.example.orderbridge.service;

import java.time.Duration;

/**
 * Blocking wait used for retry backoff.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
