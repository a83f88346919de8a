package com.rockpoint.payments.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a create-payment call. Declines are results, not exceptions:
 * {@code success=false} with the gateway's message.
 */
@Value
@Builder
public class PaymentResult {

    public static final String CONFIGURATION_ERROR = "Configuration error";

    boolean success;
    PaymentData data;
    /** Short error category, e.g. "Payment failed", "Network error". */
    String error;
    String message;
    /** True when the caller may safely submit a new attempt (transport failure). */
    boolean retryable;
    /** True when the failure is a rejected input rather than a gateway outcome. */
    boolean validationError;

    public static PaymentResult success(PaymentData data) {
        return PaymentResult.builder()
                .success(true)
                .data(data)
                .build();
    }

    public static PaymentResult failure(String error, String message, PaymentData data) {
        return PaymentResult.builder()
                .success(false)
                .error(error)
                .message(message)
                .data(data)
                .build();
    }

    public static PaymentResult invalid(String error, String message) {
        return PaymentResult.builder()
                .success(false)
                .error(error)
                .message(message)
                .validationError(true)
                .build();
    }
}
