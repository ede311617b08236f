package com.example.orderbridge.controller;

import com.example.orderbridge.config.BridgeMetrics;
import com.example.orderbridge.config.JacksonConfig;
import com.example.orderbridge.service.BridgeLifecycle;
import com.example.orderbridge.service.PollingLoop;
import com.example.orderbridge.support.TestSettings;
import com.example.orderbridge.transform.FaultInjectionPolicy;
import com.example.orderbridge.transform.MessageTransformer;
import com.example.orderbridge.transport.MessageSink;
import com.example.orderbridge.transport.TransportException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.util.List;

import static com.example.orderbridge.support.OrderFixtures.bulk;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class BridgeControllerTest {

    @Mock private BridgeLifecycle lifecycle;
    @Mock private MessageSink sourcePublisher;

    private BridgeMetrics metrics;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        metrics = new BridgeMetrics(new SimpleMeterRegistry());
        MessageTransformer transformer = new MessageTransformer(
                JacksonConfig.bridgeObjectMapper(), FaultInjectionPolicy.NONE, Clock.systemUTC());
        BridgeController controller = new BridgeController(
                lifecycle, TestSettings.defaults(), metrics, transformer, sourcePublisher);
        mockMvc = MockMvcBuilders.standaloneSetup(controller).build();
        when(sourcePublisher.name()).thenReturn("TEST.SOURCE.QUEUE");
    }

    @Test
    @DisplayName("Should report loop state, configuration and counters")
    void shouldReportStatus() throws Exception {
        // Given
        PollingLoop ingest = mock(PollingLoop.class);
        when(ingest.getLoopName()).thenReturn("ingest");
        when(ingest.state()).thenReturn("RUNNING");
        when(lifecycle.getLoops()).thenReturn(List.of(ingest));
        when(lifecycle.isRunning()).thenReturn(true);
        metrics.incrementReceived(4);
        metrics.incrementDeadLettered();

        // Then
        mockMvc.perform(get("/api/bridge/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.running").value(true))
                .andExpect(jsonPath("$.loops.ingest").value("RUNNING"))
                .andExpect(jsonPath("$.config.direction").value("QUEUE_TO_LOG"))
                .andExpect(jsonPath("$.config.maxRetries").value(3))
                .andExpect(jsonPath("$.counters.received").value(4))
                .andExpect(jsonPath("$.counters.deadLettered").value(1));
    }

    @Test
    @DisplayName("Should send test message to the source keyed by its stable key")
    void shouldSendTestMessage() throws Exception {
        mockMvc.perform(post("/api/bridge/test-messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(bulk("BATCH-7")))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.messageKey").value("BATCH-7"))
                .andExpect(jsonPath("$.type").value("BULK"))
                .andExpect(jsonPath("$.destination").value("TEST.SOURCE.QUEUE"));

        verify(sourcePublisher).send(eq("BATCH-7"), anyString());
    }

    @Test
    @DisplayName("Should answer 503 when the source transport is unavailable")
    void shouldReportSendFailure() throws Exception {
        doThrow(new TransportException("TEST.SOURCE.QUEUE", "down", null)).when(sourcePublisher).send(anyString(), anyString());

        mockMvc.perform(post("/api/bridge/test-messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"orderId\": \"ORD-1\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("FAILED"))
                .andExpect(jsonPath("$.messageKey").value("ORD-1"));
    }
}
