package com.example.orderbridge.transport.jms;

import com.example.orderbridge.transport.SourceMessage;
import com.example.orderbridge.transport.SourceQueue;
import com.example.orderbridge.transport.TransportException;
import jakarta.jms.BytesMessage;
import jakarta.jms.Connection;
import jakarta.jms.ConnectionFactory;
import jakarta.jms.JMSException;
import jakarta.jms.Message;
import jakarta.jms.MessageConsumer;
import jakarta.jms.Session;
import jakarta.jms.TextMessage;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * IBM MQ queue read through a transacted JMS session.
 *
 * <p>JMS acknowledges per session, not per message, so acknowledgements are collected and the
 * session is committed once every message of the current batch has been acknowledged.
 * {@link #release()} rolls the session back and the queue manager redelivers the whole
 * uncommitted batch, including messages that were already handled (at-least-once).
 *
 * <p>All session calls are serialized by a lock; the connection is opened lazily and
 * recreated after a failure.
 */
@Slf4j
public class JmsSourceQueue implements SourceQueue {

    private final ConnectionFactory connectionFactory;
    private final String queueName;
    private final ReentrantLock lock = new ReentrantLock();

    private final Set<String> inFlight = new LinkedHashSet<>();
    private final Set<String> acknowledged = new HashSet<>();

    private Connection connection;
    private Session session;
    private MessageConsumer consumer;

    public JmsSourceQueue(ConnectionFactory connectionFactory, String queueName) {
        this.connectionFactory = connectionFactory;
        this.queueName = queueName;
    }

    @Override
    public String name() {
        return queueName;
    }

    @Override
    public List<SourceMessage> receive(int maxMessages, Duration waitTimeout) {
        lock.lock();
        try {
            ensureOpen();
            List<SourceMessage> messages = new ArrayList<>();
            Message message = waitTimeout.isZero()
                    ? consumer.receiveNoWait()
                    : consumer.receive(waitTimeout.toMillis());
            while (message != null) {
                SourceMessage received = toSourceMessage(message);
                inFlight.add(received.messageId());
                messages.add(received);
                if (messages.size() >= maxMessages) {
                    break;
                }
                message = consumer.receiveNoWait();
            }
            return messages;
        } catch (JMSException e) {
            reset();
            throw new TransportException(queueName, "Failed to receive messages", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void ack(SourceMessage message) {
        lock.lock();
        try {
            if (!inFlight.contains(message.messageId())) {
                log.warn("Ignoring ack for message {} which is not in flight", message.messageId());
                return;
            }
            acknowledged.add(message.messageId());
            if (acknowledged.containsAll(inFlight)) {
                session.commit();
                log.debug("Committed {} message(s) on {}", inFlight.size(), queueName);
                clearBatch();
            }
        } catch (JMSException e) {
            reset();
            throw new TransportException(queueName, "Failed to commit received messages", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void release() {
        lock.lock();
        try {
            if (inFlight.isEmpty() || session == null) {
                clearBatch();
                return;
            }
            log.warn("Rolling back {} in-flight message(s) on {} for redelivery", inFlight.size(), queueName);
            session.rollback();
            clearBatch();
        } catch (JMSException e) {
            // a dropped connection rolls back on the queue manager side anyway
            log.warn("Rollback failed on {}, resetting connection: {}", queueName, e.getMessage());
            reset();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            log.info("Closing JMS source queue {}", queueName);
            reset();
        } finally {
            lock.unlock();
        }
    }

    private void ensureOpen() throws JMSException {
        if (consumer != null) {
            return;
        }
        try {
            connection = connectionFactory.createConnection();
            session = connection.createSession(true, Session.SESSION_TRANSACTED);
            consumer = session.createConsumer(session.createQueue(queueName));
            connection.start();
            log.info("JMS consumer started on queue {}", queueName);
        } catch (JMSException e) {
            reset();
            throw e;
        }
    }

    private SourceMessage toSourceMessage(Message message) throws JMSException {
        String messageId = message.getJMSMessageID() != null
                ? message.getJMSMessageID()
                : UUID.randomUUID().toString();
        String body;
        if (message instanceof TextMessage text) {
            body = text.getText();
        } else if (message instanceof BytesMessage bytes) {
            byte[] data = new byte[(int) bytes.getBodyLength()];
            bytes.readBytes(data);
            body = new String(data, StandardCharsets.UTF_8);
        } else {
            log.warn("Unsupported JMS message type {} for message {}", message.getClass().getSimpleName(), messageId);
            body = "";
        }
        return new SourceMessage(messageId, body);
    }

    private void clearBatch() {
        inFlight.clear();
        acknowledged.clear();
    }

    private void reset() {
        clearBatch();
        consumer = null;
        session = null;
        if (connection != null) {
            try {
                connection.close();
            } catch (JMSException e) {
                log.warn("Error closing JMS connection for {}", queueName, e);
            }
            connection = null;
        }
    }
}
