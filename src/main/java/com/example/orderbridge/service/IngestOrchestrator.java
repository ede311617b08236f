package com.example.orderbridge.service;

import com.example.orderbridge.config.BridgeMetrics;
import com.example.orderbridge.config.BridgeSettings;
import com.example.orderbridge.config.MessageLogContext;
import com.example.orderbridge.model.RetryEnvelope;
import com.example.orderbridge.model.TransformedOrder;
import com.example.orderbridge.retry.EnvelopeCodec;
import com.example.orderbridge.transform.MessageTransformer;
import com.example.orderbridge.transform.OrderTransformationException;
import com.example.orderbridge.transport.MessageSink;
import com.example.orderbridge.transport.SourceMessage;
import com.example.orderbridge.transport.SourceQueue;
import com.example.orderbridge.transport.TransportException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;

/**
 * Moves messages from the source to the destination.
 *
 * <p>Per message: Received → Classified → Forwarded | Routed-to-retry.
 * A message is acknowledged only after its output (or its retry envelope) was confirmed by
 * the receiving transport. Any other failure stops the batch and hands the unacknowledged
 * rest back to the source for redelivery.
 */
@Slf4j
public class IngestOrchestrator extends PollingLoop {

    public static final String LOOP_NAME = "ingest";

    private final SourceQueue source;
    private final MessageSink destination;
    private final MessageSink retrySink;
    private final MessageTransformer transformer;
    private final EnvelopeCodec codec;
    private final BridgeSettings settings;
    private final Clock clock;

    public IngestOrchestrator(
            SourceQueue source,
            MessageSink destination,
            MessageSink retrySink,
            MessageTransformer transformer,
            EnvelopeCodec codec,
            BridgeSettings settings,
            BridgeMetrics metrics,
            Clock clock) {
        super(LOOP_NAME, settings.errorBackoff(), metrics);
        this.source = source;
        this.destination = destination;
        this.retrySink = retrySink;
        this.transformer = transformer;
        this.codec = codec;
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    protected void runOnce() {
        processBatch();
    }

    @Override
    protected void closeResources() {
        source.close();
    }

    /**
     * Receives one batch and drives every message to its outcome.
     *
     * @return number of messages received
     * @throws RuntimeException if a message could not be handled; the rest of the batch has been released
     */
    public int processBatch() {
        List<SourceMessage> batch = source.receive(settings.batchSize(), settings.receiveWait());
        if (batch.isEmpty()) {
            return 0;
        }
        metrics.incrementReceived(batch.size());
        log.debug("Received {} message(s) from {}", batch.size(), source.name());

        try {
            for (SourceMessage message : batch) {
                handle(message);
            }
        } catch (RuntimeException e) {
            releaseAfter(e);
            throw e;
        }
        return batch.size();
    }

    /**
     * Transforms one message and forwards it, or routes it to the retry topic if it cannot be transformed.
     */
    public IngestOutcome handle(SourceMessage message) {
        String key = transformer.extractMessageKey(message.body());
        MessageLogContext.open(key);
        try {
            TransformedOrder order;
            long start = System.currentTimeMillis();
            try {
                order = transformer.transform(message.body());
            } catch (OrderTransformationException e) {
                metrics.incrementTransformFailures();
                routeToRetry(message, key, e);
                source.ack(message);
                return IngestOutcome.ROUTED_TO_RETRY;
            } finally {
                metrics.recordTransformTime(System.currentTimeMillis() - start);
            }

            long forwardStart = System.currentTimeMillis();
            destination.send(order.messageKey(), order.payload());
            metrics.recordForwardTime(System.currentTimeMillis() - forwardStart);
            source.ack(message);
            metrics.incrementForwarded(false);
            log.info("Forwarded {} order {} to {} as {}",
                    order.type(), order.messageKey(), destination.name(), order.output().status());
            return IngestOutcome.FORWARDED;
        } finally {
            MessageLogContext.close();
        }
    }

    private void routeToRetry(SourceMessage message, String key, OrderTransformationException error) {
        RetryEnvelope envelope = RetryEnvelope.firstFailure(message.body(), key, error, clock.instant());
        try {
            retrySink.send(key, codec.write(envelope));
        } catch (TransportException e) {
            log.error("CRITICAL: could not route message {} to retry topic {}, leaving it on {}: {}",
                    key, retrySink.name(), source.name(), e.getMessage(), e);
            throw e;
        }
        metrics.incrementRoutedToRetry();
        log.warn("Routed message {} to {}: {}", key, retrySink.name(), error.getMessage());
    }

    private void releaseAfter(RuntimeException failure) {
        try {
            source.release();
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
        }
    }
}
