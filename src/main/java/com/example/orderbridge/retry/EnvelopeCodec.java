package com.example.orderbridge.retry;

import com.example.orderbridge.model.DeadLetterRecord;
import com.example.orderbridge.model.RetryEnvelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;

/**
 * JSON text encoding of retry envelopes and dead-letter records.
 */
@RequiredArgsConstructor
public class EnvelopeCodec {

    private final ObjectMapper objectMapper;

    public String write(RetryEnvelope envelope) {
        return writeValue(envelope);
    }

    public String write(DeadLetterRecord deadLetter) {
        return writeValue(deadLetter);
    }

    /**
     * @throws JsonProcessingException if the text is not a complete, valid envelope
     */
    public RetryEnvelope readEnvelope(String json) throws JsonProcessingException {
        if (json == null) {
            throw new IllegalArgumentException("Retry record has no value");
        }
        RetryEnvelope envelope = objectMapper.readValue(json, RetryEnvelope.class);
        if (envelope == null) {
            throw new IllegalArgumentException("Retry record holds a JSON null instead of an envelope");
        }
        return envelope;
    }

    private String writeValue(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
