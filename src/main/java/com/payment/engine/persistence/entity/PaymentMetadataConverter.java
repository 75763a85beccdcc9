package com.payment.engine.persistence.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.payment.engine.domain.PaymentMetadata;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.extern.slf4j.Slf4j;

/**
 * Stores {@link PaymentMetadata} as a JSON document. Unknown keys survive a read/write
 * cycle through the metadata's extra map.
 */
@Slf4j
@Converter
public class PaymentMetadataConverter implements AttributeConverter<PaymentMetadata, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    @Override
    public String convertToDatabaseColumn(PaymentMetadata metadata) {
        if (metadata == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.error("Payment metadata serialization failed", e);
            throw new IllegalStateException("Failed to serialize payment metadata", e);
        }
    }

    @Override
    public PaymentMetadata convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return new PaymentMetadata();
        }
        try {
            return MAPPER.readValue(json, PaymentMetadata.class);
        } catch (JsonProcessingException e) {
            log.error("Payment metadata deserialization failed (length={})", json.length(), e);
            throw new IllegalStateException("Failed to deserialize payment metadata", e);
        }
    }
}
