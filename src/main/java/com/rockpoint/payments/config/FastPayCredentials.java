package com.rockpoint.payments.config;

import com.rockpoint.payments.domain.GatewayKind;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class FastPayCredentials implements GatewayCredentials {

    String merchantServiceUserId;
    @ToString.Exclude
    String secretKey;
    long serviceId;
    String apiBaseUrl;
    int requestTimeoutMs;
    String cashboxCodePrefix;
    int maxRetryAttempts;
    boolean loggingEnabled;

    @Override
    public GatewayKind gateway() {
        return GatewayKind.FAST_PAY;
    }

    static FastPayCredentials from(Map<String, String> values) {
        return FastPayCredentials.builder()
                .merchantServiceUserId(values.get("merchant_service_user_id"))
                .secretKey(values.get("secret_key"))
                .serviceId(Long.parseLong(values.get("service_id")))
                .apiBaseUrl(values.get("api_base_url"))
                .requestTimeoutMs(Integer.parseInt(values.get("request_timeout_ms")))
                .cashboxCodePrefix(values.get("cashbox_code_prefix"))
                .maxRetryAttempts(Integer.parseInt(values.get("max_retry_attempts")))
                .loggingEnabled(Boolean.parseBoolean(values.get("enable_logging")))
                .build();
    }
}
