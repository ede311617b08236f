package com.example.orderbridge.service;

import com.example.orderbridge.config.BridgeMetrics;
import com.example.orderbridge.config.BridgeSettings;
import com.example.orderbridge.config.MessageLogContext;
import com.example.orderbridge.model.DeadLetterRecord;
import com.example.orderbridge.model.RetryEnvelope;
import com.example.orderbridge.model.TransformedOrder;
import com.example.orderbridge.retry.BackoffPolicy;
import com.example.orderbridge.retry.EnvelopeCodec;
import com.example.orderbridge.transform.MessageTransformer;
import com.example.orderbridge.transform.OrderTransformationException;
import com.example.orderbridge.transport.LogRecord;
import com.example.orderbridge.transport.MessageSink;
import com.example.orderbridge.transport.RetrySource;
import com.example.orderbridge.transport.TransportException;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Reattempts messages from the retry topic.
 *
 * <p>Per envelope: Dequeued → Backoff-Wait → Reattempted → Forwarded | Re-enqueued | Quarantined.
 * The read position is committed once every envelope of the batch reached its outcome; if any
 * send fails the batch is rewound and delivered again.
 */
@Slf4j
public class RetryOrchestrator extends PollingLoop {

    public static final String LOOP_NAME = "retry";

    private final RetrySource retrySource;
    private final MessageSink destination;
    private final MessageSink retrySink;
    private final MessageSink deadLetterSink;
    private final MessageTransformer transformer;
    private final EnvelopeCodec codec;
    private final BackoffPolicy backoff;
    private final BridgeSettings settings;
    private final Clock clock;
    private final Sleeper sleeper;

    public RetryOrchestrator(
            RetrySource retrySource,
            MessageSink destination,
            MessageSink retrySink,
            MessageSink deadLetterSink,
            MessageTransformer transformer,
            EnvelopeCodec codec,
            BackoffPolicy backoff,
            BridgeSettings settings,
            BridgeMetrics metrics,
            Clock clock,
            Sleeper sleeper) {
        super(LOOP_NAME, settings.errorBackoff(), metrics);
        this.retrySource = retrySource;
        this.destination = destination;
        this.retrySink = retrySink;
        this.deadLetterSink = deadLetterSink;
        this.transformer = transformer;
        this.codec = codec;
        this.backoff = backoff;
        this.settings = settings;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    @Override
    protected void runOnce() throws InterruptedException {
        processBatch();
    }

    @Override
    protected void closeResources() {
        retrySource.close();
    }

    /**
     * Polls one batch of envelopes, drives each to its outcome and commits.
     *
     * @return number of records polled
     */
    public int processBatch() throws InterruptedException {
        List<LogRecord> batch = retrySource.poll(settings.retryPollTimeout());
        if (batch.isEmpty()) {
            return 0;
        }
        log.debug("Polled {} envelope(s) from {}", batch.size(), retrySource.name());

        try {
            for (LogRecord record : batch) {
                handle(record);
            }
            retrySource.commit();
        } catch (RuntimeException | InterruptedException e) {
            rewindAfter(e);
            throw e;
        }
        return batch.size();
    }

    /**
     * Drives one retry topic record to its outcome.
     */
    public RetryOutcome handle(LogRecord record) throws InterruptedException {
        RetryEnvelope envelope;
        try {
            envelope = codec.readEnvelope(record.value());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return quarantineUnreadable(record, e);
        }

        MessageLogContext.open(envelope.messageKey());
        try {
            int maxRetries = settings.maxRetries();
            if (envelope.retryCount() >= maxRetries) {
                deadLetter(DeadLetterRecord.fromEnvelope(envelope, clock.instant()));
                return RetryOutcome.DEAD_LETTERED;
            }

            Duration delay = backoff.delay(envelope.retryCount());
            log.info("Retrying message {} (retry {} of {}) after {}ms",
                    envelope.messageKey(), envelope.retryCount() + 1, maxRetries, delay.toMillis());
            sleeper.sleep(delay);

            TransformedOrder order;
            long start = System.currentTimeMillis();
            try {
                order = transformer.transform(envelope.originalMessage());
            } catch (OrderTransformationException e) {
                metrics.incrementTransformFailures();
                return handleFailedAttempt(envelope, e);
            } finally {
                metrics.recordTransformTime(System.currentTimeMillis() - start);
            }

            long forwardStart = System.currentTimeMillis();
            destination.send(envelope.messageKey(), order.payload());
            metrics.recordForwardTime(System.currentTimeMillis() - forwardStart);
            metrics.incrementForwarded(true);
            log.info("Forwarded {} order {} to {} on retry {}",
                    order.type(), envelope.messageKey(), destination.name(), envelope.retryCount() + 1);
            return RetryOutcome.FORWARDED;
        } finally {
            MessageLogContext.close();
        }
    }

    private RetryOutcome handleFailedAttempt(RetryEnvelope envelope, OrderTransformationException error) {
        int attempts = envelope.retryCount() + 1;
        if (attempts >= settings.maxRetries()) {
            deadLetter(DeadLetterRecord.exhausted(envelope, attempts, error, clock.instant()));
            return RetryOutcome.DEAD_LETTERED;
        }
        RetryEnvelope next = envelope.nextAttempt(error, clock.instant());
        retrySink.send(next.messageKey(), codec.write(next));
        metrics.incrementRequeued();
        log.warn("Retry {} of {} failed for message {}, re-enqueued: {}",
                attempts, settings.maxRetries(), next.messageKey(), error.getMessage());
        return RetryOutcome.REQUEUED;
    }

    private RetryOutcome quarantineUnreadable(LogRecord record, Exception error) {
        String key = record.key() != null ? record.key() : transformer.extractMessageKey(record.value());
        MessageLogContext.open(key);
        try {
            log.warn("Unreadable envelope at {}: {}", record.position(), error.getMessage());
            deadLetter(DeadLetterRecord.unreadable(record.value(), key, error, clock.instant()));
            return RetryOutcome.DEAD_LETTERED;
        } finally {
            MessageLogContext.close();
        }
    }

    private void deadLetter(DeadLetterRecord deadLetter) {
        try {
            deadLetterSink.send(deadLetter.messageKey(), codec.write(deadLetter));
        } catch (TransportException e) {
            log.error("ALERT: could not write message {} to dead-letter topic {}: {}",
                    deadLetter.messageKey(), deadLetterSink.name(), e.getMessage(), e);
            throw e;
        }
        metrics.incrementDeadLettered();
        log.error("Message {} dead-lettered to {} after {} retries: {}",
                deadLetter.messageKey(), deadLetterSink.name(), deadLetter.totalRetries(), deadLetter.finalErrorMessage());
    }

    private void rewindAfter(Exception failure) {
        try {
            retrySource.rewind();
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
        }
    }
}
