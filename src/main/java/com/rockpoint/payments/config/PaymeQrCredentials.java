package com.rockpoint.payments.config;

import com.rockpoint.payments.domain.GatewayKind;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class PaymeQrCredentials implements GatewayCredentials {

    String cashboxId;
    @ToString.Exclude
    String keyPassword;
    String apiBaseUrl;
    int requestTimeoutMs;
    int maxRetryAttempts;

    @Override
    public GatewayKind gateway() {
        return GatewayKind.PAYME_QR;
    }

    static PaymeQrCredentials from(Map<String, String> values) {
        return PaymeQrCredentials.builder()
                .cashboxId(values.get("cashbox_id"))
                .keyPassword(values.get("key_password"))
                .apiBaseUrl(values.get("api_base_url"))
                .requestTimeoutMs(Integer.parseInt(values.get("request_timeout_ms")))
                .maxRetryAttempts(Integer.parseInt(values.get("max_retry_attempts")))
                .build();
    }
}
