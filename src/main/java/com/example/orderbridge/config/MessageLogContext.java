package com.example.orderbridge.config;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC helper shared by both loops. Every message is logged with a trace id and, once known,
 * its stable key; the loop name is set once per loop thread.
 */
public final class MessageLogContext {

    public static final String TRACE_ID = "traceId";
    public static final String MESSAGE_KEY = "messageKey";
    public static final String LOOP = "loop";

    private MessageLogContext() {}

    public static void enterLoop(String loopName) {
        MDC.put(LOOP, loopName);
    }

    /**
     * Starts the log context for one message. Returns the trace id.
     */
    public static String open(String messageKey) {
        String traceId = generateTraceId();
        MDC.put(TRACE_ID, traceId);
        withKey(messageKey);
        return traceId;
    }

    public static void withKey(String messageKey) {
        if (messageKey == null || messageKey.isEmpty()) {
            MDC.remove(MESSAGE_KEY);
        } else {
            MDC.put(MESSAGE_KEY, messageKey);
        }
    }

    public static String generateTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * Clears the per-message keys; the loop name stays.
     */
    public static void close() {
        MDC.remove(TRACE_ID);
        MDC.remove(MESSAGE_KEY);
    }

    public static void clearAll() {
        close();
        MDC.remove(LOOP);
    }
}
