package com.rockpoint.payments.core;

/**
 * Input rejected before any transaction row exists. Mapped to HTTP 400.
 */
public class PaymentValidationException extends PaymentGatewayException {

    public PaymentValidationException(String message) {
        super(message);
    }
}
