package com.rockpoint.payments.core;

public class OrderIdGenerationException extends PaymentGatewayException {

    public OrderIdGenerationException(String message) {
        super(message);
    }
}
