package com.example.orderbridge.service;

import com.example.orderbridge.config.BridgeMetrics;
import com.example.orderbridge.config.MessageLogContext;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Long-running loop that repeatedly processes one batch until asked to stop.
 *
 * <p>The stop flag is checked between batches, so a batch in progress always completes.
 * A failed batch is logged and counted, then the loop pauses for the error backoff and
 * carries on. The loop owns its consumer and closes it when it exits. Single use.
 */
@Slf4j
public abstract class PollingLoop implements Runnable {

    private final String loopName;
    private final Duration errorBackoff;
    protected final BridgeMetrics metrics;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final CountDownLatch stopRequested = new CountDownLatch(1);
    private final CountDownLatch stopped = new CountDownLatch(1);

    protected PollingLoop(String loopName, Duration errorBackoff, BridgeMetrics metrics) {
        this.loopName = loopName;
        this.errorBackoff = errorBackoff;
        this.metrics = metrics;
    }

    /**
     * Processes one batch. May block while waiting for input.
     */
    protected abstract void runOnce() throws InterruptedException;

    /**
     * Releases the consumer owned by this loop. Called once, on the loop thread, when the loop exits.
     */
    protected abstract void closeResources();

    @Override
    public final void run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException(loopName + " loop has already been started");
        }
        running.set(stopRequested.getCount() > 0);
        MessageLogContext.enterLoop(loopName);
        log.info("{} loop started", loopName);
        try {
            while (running.get()) {
                try {
                    runOnce();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("{} loop interrupted, exiting", loopName);
                    break;
                } catch (RuntimeException e) {
                    metrics.incrementLoopErrors(loopName);
                    log.error("{} loop batch failed, pausing {}ms before next batch: {}",
                            loopName, errorBackoff.toMillis(), e.getMessage(), e);
                    if (!pause()) {
                        break;
                    }
                }
            }
        } finally {
            running.set(false);
            try {
                closeResources();
            } catch (RuntimeException e) {
                log.error("{} loop failed to close its consumer: {}", loopName, e.getMessage(), e);
            }
            log.info("{} loop stopped", loopName);
            MessageLogContext.clearAll();
            stopped.countDown();
        }
    }

    /**
     * Asks the loop to exit after the batch in progress.
     */
    public void requestStop() {
        running.set(false);
        stopRequested.countDown();
    }

    /**
     * @return true if the loop exited within the timeout
     */
    public boolean awaitStopped(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isRunning() {
        return running.get();
    }

    public String getLoopName() {
        return loopName;
    }

    /**
     * "NEW", "RUNNING", "STOPPING" or "STOPPED".
     */
    public String state() {
        if (stopped.getCount() == 0) {
            return "STOPPED";
        }
        if (!started.get()) {
            return "NEW";
        }
        return running.get() ? "RUNNING" : "STOPPING";
    }

    /**
     * Waits out the error backoff. Returns false if a stop was requested meanwhile.
     */
    private boolean pause() {
        try {
            return !stopRequested.await(errorBackoff.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
