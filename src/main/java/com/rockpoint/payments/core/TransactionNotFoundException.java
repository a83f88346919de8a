package com.rockpoint.payments.core;

/**
 * No transaction with the given id or order id. Mapped to HTTP 404.
 */
public class TransactionNotFoundException extends PaymentGatewayException {

    public TransactionNotFoundException(String message) {
        super(message);
    }
}
