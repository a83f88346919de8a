package com.rockpoint.payments.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Serializes outbound payloads for the request_payload columns, using the
 * same mapper as the HTTP client so the stored body matches the sent one.
 */
final class PayloadJson {

    private PayloadJson() {}

    static String write(ObjectMapper objectMapper, Object payload) {
        if (payload == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Gateway payload is not serializable", e);
        }
    }
}
