package com.example.orderbridge.transform;

import com.example.orderbridge.model.BulkOrder;
import com.example.orderbridge.model.BulkOrderEntry;
import com.example.orderbridge.model.OrderItem;
import com.example.orderbridge.model.OrderMessage;
import com.example.orderbridge.model.OrderType;
import com.example.orderbridge.model.PriorityOrder;
import com.example.orderbridge.model.StandardOrder;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates a classified JSON tree against the required fields of its variant and builds the
 * typed message. Every problem found is reported in a single exception; nothing is built
 * unless the whole message is valid.
 */
class OrderDecoder {

    static final String NO_MATCHING_SCHEMA = "no matching schema";

    OrderMessage decode(OrderType type, JsonNode root) throws OrderTransformationException {
        return switch (type) {
            case STANDARD -> standard(root);
            case PRIORITY -> priority(root);
            case BULK -> bulk(root);
            case UNKNOWN -> throw new OrderTransformationException(NO_MATCHING_SCHEMA);
        };
    }

    private StandardOrder standard(JsonNode root) throws OrderTransformationException {
        FieldReader fields = new FieldReader();
        String orderId = fields.text(root, "orderId", "");
        String customerId = fields.text(root, "customerId", "");
        List<OrderItem> items = items(root, "", fields);
        BigDecimal totalAmount = fields.decimal(root, "totalAmount", "");
        String orderDate = fields.text(root, "orderDate", "");
        fields.failIfInvalid(OrderType.STANDARD);

        return new StandardOrder(orderId, customerId, items, totalAmount, orderDate);
    }

    private PriorityOrder priority(JsonNode root) throws OrderTransformationException {
        FieldReader fields = new FieldReader();
        String orderId = fields.text(root, "orderId", "");
        String customerId = fields.text(root, "customerId", "");
        List<OrderItem> items = items(root, "", fields);
        BigDecimal totalAmount = fields.decimal(root, "totalAmount", "");
        String orderDate = fields.text(root, "orderDate", "");
        String priorityLevel = fields.text(root, "priorityLevel", "");
        String expectedDeliveryDate = fields.text(root, "expectedDeliveryDate", "");
        fields.failIfInvalid(OrderType.PRIORITY);

        return new PriorityOrder(orderId, customerId, items, totalAmount, orderDate, priorityLevel, expectedDeliveryDate);
    }

    private BulkOrder bulk(JsonNode root) throws OrderTransformationException {
        FieldReader fields = new FieldReader();
        String batchId = fields.text(root, "batchId", "");
        String customerId = fields.text(root, "customerId", "");
        Integer totalOrderCount = fields.integer(root, "totalOrderCount", "");
        BigDecimal batchTotalAmount = fields.decimal(root, "batchTotalAmount", "");
        String orderDate = fields.text(root, "orderDate", "");

        List<BulkOrderEntry> orders = new ArrayList<>();
        JsonNode ordersNode = fields.array(root, "orders", "");
        if (ordersNode != null) {
            for (int i = 0; i < ordersNode.size(); i++) {
                String path = "orders[" + i + "].";
                JsonNode entry = fields.object(ordersNode.get(i), "orders[" + i + "]");
                if (entry == null) {
                    continue;
                }
                String orderId = fields.text(entry, "orderId", path);
                List<OrderItem> items = items(entry, path, fields);
                BigDecimal totalAmount = fields.decimal(entry, "totalAmount", path);
                if (fields.isValid()) {
                    orders.add(new BulkOrderEntry(orderId, items, totalAmount));
                }
            }
        }
        fields.failIfInvalid(OrderType.BULK);

        return new BulkOrder(batchId, customerId, orders, totalOrderCount, batchTotalAmount, orderDate);
    }

    private List<OrderItem> items(JsonNode parent, String path, FieldReader fields) {
        List<OrderItem> items = new ArrayList<>();
        JsonNode itemsNode = fields.array(parent, "items", path);
        if (itemsNode == null) {
            return items;
        }
        for (int i = 0; i < itemsNode.size(); i++) {
            String itemPath = path + "items[" + i + "]";
            JsonNode item = fields.object(itemsNode.get(i), itemPath);
            if (item == null) {
                continue;
            }
            String productId = fields.text(item, "productId", itemPath + ".");
            Integer quantity = fields.integer(item, "quantity", itemPath + ".");
            BigDecimal price = fields.decimal(item, "price", itemPath + ".");
            if (productId != null && quantity != null && price != null) {
                items.add(new OrderItem(productId, quantity, price));
            }
        }
        return items;
    }

    /**
     * Reads typed fields and records a problem for each one that is absent or of the wrong type.
     */
    private static final class FieldReader {

        private final List<String> problems = new ArrayList<>();

        String text(JsonNode parent, String field, String path) {
            JsonNode node = require(parent, field, path);
            if (node == null) {
                return null;
            }
            if (!node.isTextual() || node.asText().isBlank()) {
                problems.add("field '" + path + field + "' must be a non-blank string");
                return null;
            }
            return node.asText();
        }

        Integer integer(JsonNode parent, String field, String path) {
            JsonNode node = require(parent, field, path);
            if (node == null) {
                return null;
            }
            if (!node.isIntegralNumber() || !node.canConvertToInt()) {
                problems.add("field '" + path + field + "' must be an integer");
                return null;
            }
            return node.intValue();
        }

        BigDecimal decimal(JsonNode parent, String field, String path) {
            JsonNode node = require(parent, field, path);
            if (node == null) {
                return null;
            }
            if (!node.isNumber()) {
                problems.add("field '" + path + field + "' must be a number");
                return null;
            }
            return node.decimalValue();
        }

        JsonNode array(JsonNode parent, String field, String path) {
            JsonNode node = require(parent, field, path);
            if (node == null) {
                return null;
            }
            if (!node.isArray()) {
                problems.add("field '" + path + field + "' must be an array");
                return null;
            }
            return node;
        }

        JsonNode object(JsonNode node, String path) {
            if (node == null || !node.isObject()) {
                problems.add("element '" + path + "' must be an object");
                return null;
            }
            return node;
        }

        boolean isValid() {
            return problems.isEmpty();
        }

        void failIfInvalid(OrderType type) throws OrderTransformationException {
            if (!problems.isEmpty()) {
                throw new OrderTransformationException("Invalid " + type + " order: " + String.join("; ", problems));
            }
        }

        private JsonNode require(JsonNode parent, String field, String path) {
            JsonNode node = parent.get(field);
            if (node == null || node.isNull()) {
                problems.add("missing field '" + path + field + "'");
                return null;
            }
            return node;
        }
    }
}
