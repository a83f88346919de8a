package com.rockpoint.payments.messaging;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Lifecycle event published for downstream reconciliation: payment completed
 * or failed, reversal requested, fiscal data sent. Keyed by merchant order id.
 */
@Value
@Builder
@Jacksonized
public class PaymentEvent {

    String eventId;
    /** Audit action tag, e.g. payment_completed. */
    String eventType;
    String gateway;
    String transactionId;
    String orderId;
    String gatewayPaymentId;
    String status;
    BigDecimal amount;
    Integer errorCode;
    String errorMessage;
    String employeeId;
    String terminalId;
    Instant timestamp;
}
