package com.example.orderbridge.transform;

import com.example.orderbridge.model.OrderType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class OrderClassifierTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final OrderClassifier classifier = new OrderClassifier();

    private OrderType classify(String json) throws Exception {
        return classifier.classify(objectMapper.readTree(json));
    }

    @Test
    @DisplayName("Should prefer bulk shape over every other shape")
    void shouldPreferBulkShape() throws Exception {
        String json = "{\"batchId\": \"B\", \"orders\": [], \"orderId\": \"O\", \"items\": [],"
                + " \"priorityLevel\": \"HIGH\", \"expectedDeliveryDate\": \"2024-01-01\"}";

        assertThat(classify(json)).isEqualTo(OrderType.BULK);
    }

    @Test
    @DisplayName("Should prefer priority shape over standard shape")
    void shouldPreferPriorityShape() throws Exception {
        String json = "{\"orderId\": \"O\", \"items\": [], \"priorityLevel\": \"HIGH\", \"expectedDeliveryDate\": \"2024-01-01\"}";

        assertThat(classify(json)).isEqualTo(OrderType.PRIORITY);
    }

    @Test
    @DisplayName("Should need both markers of a shape")
    void shouldNeedBothMarkers() throws Exception {
        assertThat(classify("{\"orderId\": \"O\", \"items\": [], \"priorityLevel\": \"HIGH\"}")).isEqualTo(OrderType.STANDARD);
        assertThat(classify("{\"batchId\": \"B\"}")).isEqualTo(OrderType.UNKNOWN);
        assertThat(classify("{\"orderId\": \"O\", \"items\": null}")).isEqualTo(OrderType.UNKNOWN);
    }

    @ParameterizedTest(name = "orderType={0} -> {1}")
    @CsvSource({
            "STANDARD, STANDARD",
            "priority, PRIORITY",
            "Bulk, BULK",
            "UNKNOWN, UNKNOWN",
            "EXPRESS, UNKNOWN"
    })
    @DisplayName("Should resolve discriminator ignoring case")
    void shouldResolveDiscriminator(String discriminator, OrderType expected) throws Exception {
        String json = "{\"orderType\": \"" + discriminator + "\", \"batchId\": \"B\", \"orders\": []}";

        assertThat(classify(json)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should treat non-text discriminator as unknown and null discriminator as absent")
    void shouldHandleOddDiscriminators() throws Exception {
        assertThat(classify("{\"orderType\": 7, \"orderId\": \"O\", \"items\": []}")).isEqualTo(OrderType.UNKNOWN);
        assertThat(classify("{\"orderType\": null, \"orderId\": \"O\", \"items\": []}")).isEqualTo(OrderType.STANDARD);
    }

    @Test
    @DisplayName("Should classify non-object as unknown")
    void shouldClassifyNonObjectAsUnknown() throws Exception {
        assertThat(classify("\"text\"")).isEqualTo(OrderType.UNKNOWN);
        assertThat(classifier.classify(null)).isEqualTo(OrderType.UNKNOWN);
    }
}
