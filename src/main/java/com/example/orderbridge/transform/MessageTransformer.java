package com.example.orderbridge.transform;

import com.example.orderbridge.model.BulkOrder;
import com.example.orderbridge.model.CanonicalOrder;
import com.example.orderbridge.model.CompletedOrder;
import com.example.orderbridge.model.DeliveredOrder;
import com.example.orderbridge.model.OrderMessage;
import com.example.orderbridge.model.OrderType;
import com.example.orderbridge.model.PriorityOrder;
import com.example.orderbridge.model.StandardOrder;
import com.example.orderbridge.model.TransformedOrder;
import com.example.orderbridge.model.WipOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;

/**
 * Classifies a raw source message, validates it and projects it onto its canonical output record.
 *
 * <p>Pipeline: decode JSON tree, classify, validate the variant's required fields, then build
 * the output. Status literals are constants and timestamps come from the clock at the time of
 * the attempt, never from the input. Item counts are derived from the item collections.
 *
 * <p>Stateless with respect to message data; safe to share between the ingest and retry loops.
 */
@Slf4j
public class MessageTransformer {

    public static final String UNKNOWN_KEY = "unknown";

    private final ObjectMapper objectMapper;
    private final FaultInjectionPolicy faultInjection;
    private final Clock clock;
    private final OrderClassifier classifier = new OrderClassifier();
    private final OrderDecoder decoder = new OrderDecoder();

    public MessageTransformer(ObjectMapper objectMapper, FaultInjectionPolicy faultInjection, Clock clock) {
        this.objectMapper = objectMapper;
        this.faultInjection = faultInjection;
        this.clock = clock;
    }

    /**
     * Transform a raw message into its output record.
     *
     * @param raw message body as received from the source transport
     * @return output record, its stable key and serialized payload
     * @throws OrderTransformationException if the message is malformed, unknown or invalid
     */
    public TransformedOrder transform(String raw) throws OrderTransformationException {
        JsonNode root = parse(raw);
        OrderType type = classifier.classify(root);
        OrderMessage message = decoder.decode(type, root);

        if (faultInjection.shouldFail(message.messageKey())) {
            throw new OrderTransformationException("Simulated transformation failure for " + message.messageKey());
        }

        Instant now = clock.instant();
        CanonicalOrder output;
        if (message instanceof StandardOrder standard) {
            output = WipOrder.of(standard, now);
        } else if (message instanceof PriorityOrder priority) {
            output = DeliveredOrder.of(priority, now);
        } else if (message instanceof BulkOrder bulk) {
            output = CompletedOrder.of(bulk, now);
        } else {
            throw new OrderTransformationException(OrderDecoder.NO_MATCHING_SCHEMA);
        }

        log.debug("Transformed {} order {} -> {} ({} items)",
                type, message.messageKey(), output.status(), output.itemsCount());
        return new TransformedOrder(type, message.messageKey(), output, serialize(output));
    }

    /**
     * Classify a raw message without validating it.
     */
    public OrderType classify(String raw) {
        try {
            return classifier.classify(objectMapper.readTree(raw));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return OrderType.UNKNOWN;
        }
    }

    /**
     * Best-effort stable key for a raw message, also for messages that fail validation.
     * Bulk shapes use {@code batchId}, everything else {@code orderId}; {@value #UNKNOWN_KEY}
     * when neither can be read.
     */
    public String extractMessageKey(String raw) {
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("Could not read message key: {}", e.getMessage());
            return UNKNOWN_KEY;
        }
        if (root == null || !root.isObject()) {
            return UNKNOWN_KEY;
        }
        String batchId = textOrNull(root, "batchId");
        String orderId = textOrNull(root, "orderId");
        if (classifier.classify(root) == OrderType.BULK && batchId != null) {
            return batchId;
        }
        if (orderId != null) {
            return orderId;
        }
        return batchId != null ? batchId : UNKNOWN_KEY;
    }

    private JsonNode parse(String raw) throws OrderTransformationException {
        if (raw == null || raw.isBlank()) {
            throw new OrderTransformationException("empty message body");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new OrderTransformationException("malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new OrderTransformationException("message body is not a JSON object");
        }
        return root;
    }

    private String serialize(CanonicalOrder output) {
        try {
            return objectMapper.writeValueAsString(output);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + output.getClass().getSimpleName(), e);
        }
    }

    private static String textOrNull(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node != null && node.isTextual() && !node.asText().isBlank() ? node.asText() : null;
    }
}
