package com.rockpoint.payments.core.http;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

/**
 * Any HTTP response from the gateway, including 4xx/5xx. A business decline
 * inside a response is not a client error.
 */
@Value
@Builder
public class GatewayResponse {

    int httpStatus;
    /** Parsed body; a {@code MissingNode} when the body was empty or not JSON. */
    JsonNode body;
    String rawBody;
    long responseTimeMs;
}
