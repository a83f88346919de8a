package com.rockpoint.payments.core.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.rockpoint.payments.core.auth.AuthHeader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link GatewayClient} on Spring's {@link RestTemplate}. One template per
 * read timeout; gateways keep their timeout in config so the map stays tiny.
 */
@Slf4j
@Component
public class RestTemplateGatewayClient implements GatewayClient {

    private final RestTemplateBuilder restTemplateBuilder;
    private final ObjectMapper objectMapper;
    private final Map<Integer, RestTemplate> templatesByTimeout = new ConcurrentHashMap<>();

    @Value("${payments.http.connect-timeout:5s}")
    private Duration connectTimeout = Duration.ofSeconds(5);

    @Value("${payments.http.user-agent:RockPoint-POS/1.0}")
    private String userAgent = "RockPoint-POS/1.0";

    public RestTemplateGatewayClient(RestTemplateBuilder restTemplateBuilder, ObjectMapper objectMapper) {
        this.restTemplateBuilder = restTemplateBuilder;
        this.objectMapper = objectMapper;
    }

    @Override
    public GatewayResponse call(GatewayCall call, AuthHeader authHeader, int timeoutMs) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(HttpHeaders.USER_AGENT, userAgent);
        headers.set(authHeader.getHeaderName(), authHeader.getValue());

        String body = call.getMethod() == HttpMethod.GET || call.getPayload() == null ? null : toJson(call.getPayload());
        HttpEntity<String> entity = new HttpEntity<>(body, headers);

        long start = System.nanoTime();
        try {
            ResponseEntity<String> response = restTemplate(timeoutMs)
                    .exchange(call.getEndpoint(), call.getMethod(), entity, String.class);
            long elapsed = elapsedMs(start);
            log.debug("Gateway call {} {} -> {} in {}ms", call.getMethod(), call.getEndpoint(),
                    response.getStatusCode().value(), elapsed);
            return toResponse(response.getStatusCode().value(), response.getBody(), elapsed);
        } catch (RestClientResponseException e) {
            long elapsed = elapsedMs(start);
            log.warn("Gateway call {} {} returned HTTP {} in {}ms", call.getMethod(), call.getEndpoint(),
                    e.getStatusCode().value(), elapsed);
            return toResponse(e.getStatusCode().value(), e.getResponseBodyAsString(), elapsed);
        } catch (ResourceAccessException e) {
            long elapsed = elapsedMs(start);
            if (isTimeout(e)) {
                log.warn("Gateway call {} {} timed out after {}ms", call.getMethod(), call.getEndpoint(), elapsed);
                throw new GatewayTimeoutException(timeoutMs, elapsed, e);
            }
            log.warn("Gateway call {} {} failed: {}", call.getMethod(), call.getEndpoint(), e.getMessage());
            throw new GatewayNetworkException(e.getMessage(), elapsed, e);
        } catch (RestClientException e) {
            long elapsed = elapsedMs(start);
            log.warn("Gateway call {} {} failed: {}", call.getMethod(), call.getEndpoint(), e.getMessage());
            throw new GatewayNetworkException(e.getMessage(), elapsed, e);
        }
    }

    /** Template with the given read timeout; overridable so tests can bind a mock server. */
    protected RestTemplate restTemplate(int timeoutMs) {
        return templatesByTimeout.computeIfAbsent(timeoutMs, t -> restTemplateBuilder
                .connectTimeout(connectTimeout)
                .readTimeout(Duration.ofMillis(t))
                .build());
    }

    private GatewayResponse toResponse(int status, String rawBody, long elapsedMs) {
        return GatewayResponse.builder()
                .httpStatus(status)
                .rawBody(rawBody)
                .body(parse(rawBody))
                .responseTimeMs(elapsedMs)
                .build();
    }

    private JsonNode parse(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(rawBody);
        } catch (JsonProcessingException e) {
            log.warn("Gateway response is not JSON (length={})", rawBody.length());
            return MissingNode.getInstance();
        }
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Gateway payload is not serializable", e);
        }
    }

    private static boolean isTimeout(Throwable e) {
        Throwable t = e;
        while (t != null) {
            if (t instanceof SocketTimeoutException) {
                return true;
            }
            t = t.getCause();
        }
        return false;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
