package com.example.orderbridge;

import com.example.orderbridge.config.BridgeDirection;
import com.example.orderbridge.config.BridgeSettings;
import com.example.orderbridge.service.BridgeLifecycle;
import com.example.orderbridge.transform.FaultInjectionPolicy;
import com.example.orderbridge.transform.PrefixFaultInjectionPolicy;
import com.example.orderbridge.transport.MessageSink;
import com.example.orderbridge.transport.SourceQueue;
import com.example.orderbridge.transport.jms.JmsSourceQueue;
import com.example.orderbridge.transport.kafka.KafkaTopicSink;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Wiring check. Loops stay stopped, so no broker or queue manager is contacted.
 */
@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = {
                "app.bridge.auto-start=false",
                "app.bridge.max-retries=5",
                "app.bridge.receive-wait=2s",
                "app.fault-injection.enabled=true"
        })
class OrderBridgeApplicationTest {

    @Autowired private BridgeSettings settings;
    @Autowired private BridgeLifecycle lifecycle;
    @Autowired private SourceQueue sourceQueue;
    @Autowired private FaultInjectionPolicy faultInjectionPolicy;
    @Autowired @Qualifier("destinationSink") private MessageSink destinationSink;
    @Autowired @Qualifier("deadLetterSink") private MessageSink deadLetterSink;

    @Test
    void contextLoadsWithQueueToLogWiring() {
        assertThat(settings.direction()).isEqualTo(BridgeDirection.QUEUE_TO_LOG);
        assertThat(settings.maxRetries()).isEqualTo(5);
        assertThat(settings.receiveWait()).isEqualTo(Duration.ofSeconds(2));

        assertThat(sourceQueue).isInstanceOf(JmsSourceQueue.class);
        assertThat(sourceQueue.name()).isEqualTo("PLACE.ORDER.QUEUE");
        assertThat(destinationSink).isInstanceOf(KafkaTopicSink.class);
        assertThat(destinationSink.name()).isEqualTo("place-order-topic");
        assertThat(deadLetterSink.name()).isEqualTo("place-order-dlq-topic");

        assertThat(faultInjectionPolicy).isInstanceOf(PrefixFaultInjectionPolicy.class);
        assertThat(lifecycle.isRunning()).isFalse();
    }
}
