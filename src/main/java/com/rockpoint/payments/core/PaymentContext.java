package com.rockpoint.payments.core;

import com.rockpoint.payments.domain.CreatePaymentRequest;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Identifiers and converted amount for one create call, handed to the
 * gateway integration to build its payload.
 */
@Value
@Builder
public class PaymentContext {

    CreatePaymentRequest request;
    String orderId;
    /** Our id sent to the gateway as its transaction reference. */
    String gatewayTransactionId;
    long amountMinor;
    BigDecimal amountMajor;
    String cashboxCode;
}
