package com.example.orderbridge.transport.jms;

import com.example.orderbridge.transport.MessageSink;
import com.example.orderbridge.transport.TransportException;
import jakarta.jms.TextMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jms.JmsException;
import org.springframework.jms.core.JmsTemplate;

/**
 * Sends payloads to an IBM MQ queue as text messages.
 * The stable key travels as {@code JMSXGroupID} so consumers can keep per-key ordering.
 */
@Slf4j
public class JmsQueueSink implements MessageSink {

    static final String GROUP_ID_PROPERTY = "JMSXGroupID";

    private final JmsTemplate jmsTemplate;
    private final String queueName;

    public JmsQueueSink(JmsTemplate jmsTemplate, String queueName) {
        this.jmsTemplate = jmsTemplate;
        this.queueName = queueName;
    }

    @Override
    public String name() {
        return queueName;
    }

    @Override
    public void send(String key, String payload) {
        try {
            jmsTemplate.send(queueName, session -> {
                TextMessage message = session.createTextMessage(payload);
                message.setStringProperty(GROUP_ID_PROPERTY, key);
                return message;
            });
            log.info("Message sent to queue {} - key: {}", queueName, key);
        } catch (JmsException e) {
            throw new TransportException(queueName, "Failed to send message with key " + key, e);
        }
    }
}
