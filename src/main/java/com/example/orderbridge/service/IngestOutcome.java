package com.example.orderbridge.service;

/**
 * Terminal state of one source message in the ingest loop.
 */
public enum IngestOutcome {
    FORWARDED,
    ROUTED_TO_RETRY
}
