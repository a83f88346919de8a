package com.rockpoint.payments.domain;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Reconciliation data returned with every create-payment outcome once a
 * transaction row exists, whether the payment succeeded or not.
 */
@Value
@Builder
public class PaymentData {

    String transactionId;
    String orderId;
    String gatewayPaymentId;
    TransactionStatus status;
    Integer errorCode;
    String errorMessage;
    int retryCount;
    long processingTimeMs;
    Map<String, Object> metadata;
}
