package com.rockpoint.payments.core.http;

import lombok.Builder;
import lombok.Value;
import org.springframework.http.HttpMethod;

import java.util.Map;

/**
 * One outbound request: endpoint, verb and JSON payload (ignored for GET).
 */
@Value
@Builder
public class GatewayCall {

    HttpMethod method;
    String endpoint;
    Map<String, Object> payload;
}
