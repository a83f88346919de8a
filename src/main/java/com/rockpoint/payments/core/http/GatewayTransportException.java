package com.rockpoint.payments.core.http;

import com.rockpoint.payments.core.PaymentGatewayException;
import lombok.Getter;

/**
 * No HTTP response was received from the gateway. Retried by the orchestrator
 * up to the configured attempt count.
 */
@Getter
public abstract class GatewayTransportException extends PaymentGatewayException {

    private final long elapsedMs;

    protected GatewayTransportException(String message, long elapsedMs, Throwable cause) {
        super(message, cause);
        this.elapsedMs = elapsedMs;
    }

    public abstract boolean isTimeout();
}
