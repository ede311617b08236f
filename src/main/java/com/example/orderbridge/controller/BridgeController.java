package com.example.orderbridge.controller;

import com.example.orderbridge.config.BridgeMetrics;
import com.example.orderbridge.config.BridgeSettings;
import com.example.orderbridge.service.BridgeLifecycle;
import com.example.orderbridge.service.PollingLoop;
import com.example.orderbridge.transform.MessageTransformer;
import com.example.orderbridge.transport.MessageSink;
import com.example.orderbridge.transport.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bridge status and test message injection.
 *
 * GET  /api/bridge/status         - loop state, configuration and counters
 * POST /api/bridge/test-messages  - puts a raw JSON order on the source queue or topic
 */
@RestController
@RequestMapping("/api/bridge")
@Slf4j
public class BridgeController {

    private final BridgeLifecycle lifecycle;
    private final BridgeSettings settings;
    private final BridgeMetrics metrics;
    private final MessageTransformer transformer;
    private final MessageSink sourcePublisher;

    public BridgeController(
            BridgeLifecycle lifecycle,
            BridgeSettings settings,
            BridgeMetrics metrics,
            MessageTransformer transformer,
            @Qualifier("sourcePublisher") MessageSink sourcePublisher) {
        this.lifecycle = lifecycle;
        this.settings = settings;
        this.metrics = metrics;
        this.transformer = transformer;
        this.sourcePublisher = sourcePublisher;
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("timestamp", Instant.now().toString());
        response.put("running", lifecycle.isRunning());

        Map<String, String> loops = new LinkedHashMap<>();
        for (PollingLoop loop : lifecycle.getLoops()) {
            loops.put(loop.getLoopName(), loop.state());
        }
        response.put("loops", loops);

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("direction", settings.direction().name());
        config.put("source", settings.source());
        config.put("destination", settings.destination());
        config.put("retryTopic", settings.retryTopic());
        config.put("dlqTopic", settings.dlqTopic());
        config.put("maxRetries", settings.maxRetries());
        config.put("batchSize", settings.batchSize());
        response.put("config", config);

        Map<String, Long> counters = new LinkedHashMap<>();
        counters.put("received", (long) metrics.getReceivedCounter().count());
        counters.put("forwarded", (long) metrics.getIngestForwardedCounter().count());
        counters.put("forwardedOnRetry", (long) metrics.getRetryForwardedCounter().count());
        counters.put("routedToRetry", (long) metrics.getRoutedToRetryCounter().count());
        counters.put("requeued", (long) metrics.getRequeuedCounter().count());
        counters.put("deadLettered", (long) metrics.getDeadLetteredCounter().count());
        counters.put("transformFailures", (long) metrics.getTransformFailuresCounter().count());
        counters.put("ingestLoopErrors", (long) metrics.getIngestErrorsCounter().count());
        counters.put("retryLoopErrors", (long) metrics.getRetryErrorsCounter().count());
        response.put("counters", counters);

        return response;
    }

    /**
     * Sends the body as-is; invalid orders are accepted too, so the retry path can be exercised.
     *
     * Example: POST /api/bridge/test-messages {"orderId":"ORD-RETRY-1", ...}
     */
    @PostMapping(path = "/test-messages", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> sendTestMessage(@RequestBody String body) {
        String key = transformer.extractMessageKey(body);
        try {
            sourcePublisher.send(key, body);
        } catch (TransportException e) {
            log.error("Failed to send test message {} to {}: {}", key, sourcePublisher.name(), e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of(
                    "status", "FAILED",
                    "messageKey", key,
                    "error", e.getMessage()
            ));
        }
        log.info("Test message {} sent to {}", key, sourcePublisher.name());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                "status", "SENT",
                "messageKey", key,
                "type", transformer.classify(body).name(),
                "destination", sourcePublisher.name()
        ));
    }
}
