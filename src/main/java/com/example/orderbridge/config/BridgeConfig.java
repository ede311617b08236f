package com.example.orderbridge.config;

import com.example.orderbridge.retry.BackoffPolicy;
import com.example.orderbridge.retry.EnvelopeCodec;
import com.example.orderbridge.service.IngestOrchestrator;
import com.example.orderbridge.service.RetryOrchestrator;
import com.example.orderbridge.service.Sleeper;
import com.example.orderbridge.transform.FaultInjectionPolicy;
import com.example.orderbridge.transform.MessageTransformer;
import com.example.orderbridge.transform.PrefixFaultInjectionPolicy;
import com.example.orderbridge.transport.MessageSink;
import com.example.orderbridge.transport.RetrySource;
import com.example.orderbridge.transport.SourceQueue;
import com.example.orderbridge.transport.jms.JmsQueueSink;
import com.example.orderbridge.transport.jms.JmsSourceQueue;
import com.example.orderbridge.transport.kafka.KafkaRetrySource;
import com.example.orderbridge.transport.kafka.KafkaSourceQueue;
import com.example.orderbridge.transport.kafka.KafkaTopicSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.jms.ConnectionFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jms.core.JmsTemplate;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Wires the bridge: settings, transformer, transports for the configured direction and both loops.
 *
 * queue-to-log: IBM MQ source queue  → Kafka destination topic
 * log-to-queue: Kafka source topic   → IBM MQ destination queue
 * Retry and dead-letter topics are Kafka in both directions.
 */
@Configuration
@Slf4j
public class BridgeConfig {

    static final String RETRY_GROUP_ID = "order-bridge-retry";
    static final String SOURCE_GROUP_ID = "order-bridge-source";

    @Bean
    public BridgeSettings bridgeSettings(
            @Value("${app.bridge.direction:queue-to-log}") String direction,
            @Value("${app.bridge.source:PLACE.ORDER.QUEUE}") String source,
            @Value("${app.bridge.destination:place-order-topic}") String destination,
            @Value("${app.bridge.retry-topic:place-order-retry-topic}") String retryTopic,
            @Value("${app.bridge.dlq-topic:place-order-dlq-topic}") String dlqTopic,
            @Value("${app.bridge.max-retries:3}") int maxRetries,
            @Value("${app.bridge.batch-size:10}") int batchSize,
            @Value("${app.bridge.receive-wait:20s}") Duration receiveWait,
            @Value("${app.bridge.retry-poll-timeout:10s}") Duration retryPollTimeout,
            @Value("${app.bridge.error-backoff:5s}") Duration errorBackoff,
            @Value("${app.bridge.send-timeout:30s}") Duration sendTimeout,
            @Value("${app.bridge.shutdown-timeout:60s}") Duration shutdownTimeout,
            @Value("${app.bridge.backoff.base:1s}") Duration backoffBase,
            @Value("${app.bridge.backoff.cap:30s}") Duration backoffCap) {

        BridgeSettings settings = new BridgeSettings(
                BridgeDirection.parse(direction), source, destination, retryTopic, dlqTopic,
                maxRetries, batchSize, receiveWait, retryPollTimeout, errorBackoff,
                sendTimeout, shutdownTimeout, backoffBase, backoffCap);
        log.info("Bridge {}: {} → {} | retry: {} | dlq: {} | max retries: {}",
                settings.direction(), source, destination, retryTopic, dlqTopic, maxRetries);
        return settings;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FaultInjectionPolicy faultInjectionPolicy(
            @Value("${app.fault-injection.enabled:false}") boolean enabled,
            @Value("${app.fault-injection.fail-once-prefixes:ORD-RETRY-}") List<String> failOncePrefixes,
            @Value("${app.fault-injection.always-fail-prefixes:ORD-DLQ-}") List<String> alwaysFailPrefixes) {
        return enabled
                ? new PrefixFaultInjectionPolicy(failOncePrefixes, alwaysFailPrefixes)
                : FaultInjectionPolicy.NONE;
    }

    @Bean
    public BackoffPolicy backoffPolicy(BridgeSettings settings) {
        return new BackoffPolicy(settings.backoffBase(), settings.backoffCap());
    }

    @Bean
    public MessageTransformer messageTransformer(ObjectMapper objectMapper, FaultInjectionPolicy faultInjectionPolicy, Clock clock) {
        return new MessageTransformer(objectMapper, faultInjectionPolicy, clock);
    }

    @Bean
    public EnvelopeCodec envelopeCodec(ObjectMapper objectMapper) {
        return new EnvelopeCodec(objectMapper);
    }

    // ═══════════════════════════════════════════════════════════════
    // TRANSPORTS
    // ═══════════════════════════════════════════════════════════════

    @Bean
    public SourceQueue sourceQueue(
            BridgeSettings settings,
            ConnectionFactory connectionFactory,
            ConsumerFactory<String, String> consumerFactory) {
        if (settings.direction() == BridgeDirection.QUEUE_TO_LOG) {
            return new JmsSourceQueue(connectionFactory, settings.source());
        }
        return new KafkaSourceQueue(() -> consumerFactory.createConsumer(SOURCE_GROUP_ID, "source"), settings.source());
    }

    @Bean
    public MessageSink destinationSink(
            BridgeSettings settings,
            KafkaTemplate<String, String> kafkaTemplate,
            JmsTemplate jmsTemplate) {
        if (settings.direction() == BridgeDirection.QUEUE_TO_LOG) {
            return new KafkaTopicSink(kafkaTemplate, settings.destination(), settings.sendTimeout());
        }
        return new JmsQueueSink(jmsTemplate, settings.destination());
    }

    /**
     * Writes to the source side; used to inject test messages.
     */
    @Bean
    public MessageSink sourcePublisher(
            BridgeSettings settings,
            KafkaTemplate<String, String> kafkaTemplate,
            JmsTemplate jmsTemplate) {
        if (settings.direction() == BridgeDirection.QUEUE_TO_LOG) {
            return new JmsQueueSink(jmsTemplate, settings.source());
        }
        return new KafkaTopicSink(kafkaTemplate, settings.source(), settings.sendTimeout());
    }

    @Bean
    public MessageSink retrySink(BridgeSettings settings, KafkaTemplate<String, String> kafkaTemplate) {
        return new KafkaTopicSink(kafkaTemplate, settings.retryTopic(), settings.sendTimeout());
    }

    @Bean
    public MessageSink deadLetterSink(BridgeSettings settings, KafkaTemplate<String, String> kafkaTemplate) {
        return new KafkaTopicSink(kafkaTemplate, settings.dlqTopic(), settings.sendTimeout());
    }

    @Bean
    public RetrySource retrySource(BridgeSettings settings, ConsumerFactory<String, String> consumerFactory) {
        return new KafkaRetrySource(() -> consumerFactory.createConsumer(RETRY_GROUP_ID, "retry"), settings.retryTopic());
    }

    // ═══════════════════════════════════════════════════════════════
    // LOOPS
    // ═══════════════════════════════════════════════════════════════

    @Bean
    public IngestOrchestrator ingestOrchestrator(
            SourceQueue sourceQueue,
            @Qualifier("destinationSink") MessageSink destinationSink,
            @Qualifier("retrySink") MessageSink retrySink,
            MessageTransformer messageTransformer,
            EnvelopeCodec envelopeCodec,
            BridgeSettings settings,
            BridgeMetrics metrics,
            Clock clock) {
        return new IngestOrchestrator(sourceQueue, destinationSink, retrySink, messageTransformer,
                envelopeCodec, settings, metrics, clock);
    }

    @Bean
    public RetryOrchestrator retryOrchestrator(
            RetrySource retrySource,
            @Qualifier("destinationSink") MessageSink destinationSink,
            @Qualifier("retrySink") MessageSink retrySink,
            @Qualifier("deadLetterSink") MessageSink deadLetterSink,
            MessageTransformer messageTransformer,
            EnvelopeCodec envelopeCodec,
            BackoffPolicy backoffPolicy,
            BridgeSettings settings,
            BridgeMetrics metrics,
            Clock clock) {
        return new RetryOrchestrator(retrySource, destinationSink, retrySink, deadLetterSink, messageTransformer,
                envelopeCodec, backoffPolicy, settings, metrics, clock, Sleeper.THREAD);
    }
}
