package com.rockpoint.payments.config;

import com.rockpoint.payments.domain.GatewayKind;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class ClickPassCredentials implements GatewayCredentials {

    long serviceId;
    long merchantId;
    long merchantUserId;
    @ToString.Exclude
    String secretKey;
    String apiBaseUrl;
    int requestTimeoutMs;
    int maxRetryAttempts;

    @Override
    public GatewayKind gateway() {
        return GatewayKind.CLICK_PASS;
    }

    static ClickPassCredentials from(Map<String, String> values) {
        return ClickPassCredentials.builder()
                .serviceId(Long.parseLong(values.get("service_id")))
                .merchantId(Long.parseLong(values.get("merchant_id")))
                .merchantUserId(Long.parseLong(values.get("merchant_user_id")))
                .secretKey(values.get("secret_key"))
                .apiBaseUrl(values.get("api_base_url"))
                .requestTimeoutMs(Integer.parseInt(values.get("request_timeout_ms")))
                .maxRetryAttempts(Integer.parseInt(values.get("max_retry_attempts")))
                .build();
    }
}
