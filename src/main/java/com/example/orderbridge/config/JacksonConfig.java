package com.example.orderbridge.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Shared ObjectMapper for order payloads, retry envelopes and dead-letter records.
 */
@Configuration
public class JacksonConfig {

    @Bean
    public ObjectMapper objectMapper() {
        return bridgeObjectMapper();
    }

    /**
     * Same settings as the bean, for code and tests that run outside the context.
     */
    public static ObjectMapper bridgeObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        // Instants on envelopes and output records
        mapper.registerModule(new JavaTimeModule());
        // ISO-8601 text, not epoch numbers
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // Envelopes written by newer versions may carry extra fields
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
