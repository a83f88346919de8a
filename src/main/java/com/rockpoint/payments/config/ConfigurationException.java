package com.rockpoint.payments.config;

import com.rockpoint.payments.core.PaymentGatewayException;
import com.rockpoint.payments.domain.GatewayKind;
import lombok.Getter;

import java.util.List;

/**
 * Gateway credentials are missing, still hold the placeholder, or do not parse.
 * Fatal for the current call; never retried.
 */
@Getter
public class ConfigurationException extends PaymentGatewayException {

    private final GatewayKind gateway;
    private final List<String> missingKeys;

    public ConfigurationException(GatewayKind gateway, String message, List<String> missingKeys) {
        super(message);
        this.gateway = gateway;
        this.missingKeys = missingKeys != null ? List.copyOf(missingKeys) : List.of();
    }

    public ConfigurationException(GatewayKind gateway, String message, Throwable cause) {
        super(message, cause);
        this.gateway = gateway;
        this.missingKeys = List.of();
    }
}
