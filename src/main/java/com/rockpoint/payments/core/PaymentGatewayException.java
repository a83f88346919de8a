package com.rockpoint.payments.core;

/**
 * Base type for failures raised inside the gateway integration layer. The
 * orchestrator converts these into results at its boundary; they only reach
 * the REST layer from read-side or admin operations.
 */
public class PaymentGatewayException extends RuntimeException {

    public PaymentGatewayException(String message) {
        super(message);
    }

    public PaymentGatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
