package com.example.orderbridge.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Bridge metrics.
 *
 * View at: http://localhost:8080/actuator/metrics
 *
 * Key metrics:
 * - bridge.messages.received            → Messages received from the source
 * - bridge.messages.forwarded{path}     → Forwarded to the destination (path=ingest|retry)
 * - bridge.messages.retry.routed        → First failures routed to the retry topic
 * - bridge.messages.retry.requeued      → Envelopes re-enqueued after another failure
 * - bridge.messages.deadlettered        → Envelopes quarantined to the dead-letter topic
 * - bridge.loop.errors{loop}            → Batches aborted at the loop boundary
 * - bridge.transform.time               → Transformation latency
 */
@Component
@Getter
public class BridgeMetrics {

    private final Timer transformTimer;
    private final Timer forwardTimer;

    private final Counter receivedCounter;
    private final Counter ingestForwardedCounter;
    private final Counter retryForwardedCounter;
    private final Counter routedToRetryCounter;
    private final Counter requeuedCounter;
    private final Counter deadLetteredCounter;
    private final Counter transformFailuresCounter;
    private final Counter ingestErrorsCounter;
    private final Counter retryErrorsCounter;

    public BridgeMetrics(MeterRegistry registry) {
        // ═══════════════════════════════════════════════════════════════
        // TIMERS
        // ═══════════════════════════════════════════════════════════════

        this.transformTimer = Timer.builder("bridge.transform.time")
                .description("Time spent classifying and transforming a message")
                .register(registry);

        this.forwardTimer = Timer.builder("bridge.forward.time")
                .description("Time spent waiting for the destination to confirm a forward")
                .register(registry);

        // ═══════════════════════════════════════════════════════════════
        // COUNTERS
        // ═══════════════════════════════════════════════════════════════

        this.receivedCounter = Counter.builder("bridge.messages.received")
                .description("Messages received from the source transport")
                .register(registry);

        this.ingestForwardedCounter = Counter.builder("bridge.messages.forwarded")
                .description("Messages forwarded to the destination")
                .tag("path", "ingest")
                .register(registry);

        this.retryForwardedCounter = Counter.builder("bridge.messages.forwarded")
                .description("Messages forwarded to the destination")
                .tag("path", "retry")
                .register(registry);

        this.routedToRetryCounter = Counter.builder("bridge.messages.retry.routed")
                .description("Messages routed to the retry topic after their first failure")
                .register(registry);

        this.requeuedCounter = Counter.builder("bridge.messages.retry.requeued")
                .description("Envelopes re-enqueued to the retry topic")
                .register(registry);

        this.deadLetteredCounter = Counter.builder("bridge.messages.deadlettered")
                .description("Envelopes quarantined to the dead-letter topic")
                .register(registry);

        this.transformFailuresCounter = Counter.builder("bridge.transform.failures")
                .description("Failed transformation attempts (first attempts and retries)")
                .register(registry);

        this.ingestErrorsCounter = Counter.builder("bridge.loop.errors")
                .description("Batches aborted by an unexpected error")
                .tag("loop", "ingest")
                .register(registry);

        this.retryErrorsCounter = Counter.builder("bridge.loop.errors")
                .description("Batches aborted by an unexpected error")
                .tag("loop", "retry")
                .register(registry);
    }

    public void recordTransformTime(long millis) {
        transformTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordForwardTime(long millis) {
        forwardTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void incrementReceived(int count) {
        receivedCounter.increment(count);
    }

    public void incrementForwarded(boolean fromRetry) {
        (fromRetry ? retryForwardedCounter : ingestForwardedCounter).increment();
    }

    public void incrementRoutedToRetry() {
        routedToRetryCounter.increment();
    }

    public void incrementRequeued() {
        requeuedCounter.increment();
    }

    public void incrementDeadLettered() {
        deadLetteredCounter.increment();
    }

    public void incrementTransformFailures() {
        transformFailuresCounter.increment();
    }

    public void incrementLoopErrors(String loop) {
        ("retry".equals(loop) ? retryErrorsCounter : ingestErrorsCounter).increment();
    }
}
