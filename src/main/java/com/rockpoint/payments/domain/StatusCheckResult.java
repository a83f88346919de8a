package com.rockpoint.payments.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Gateway's view of a payment next to the local status. Polling never
 * changes the local status; divergence is resolved by explicit reconciliation.
 */
@Value
@Builder
public class StatusCheckResult {

    boolean success;
    TransactionStatus localStatus;
    /** Raw status value reported by the gateway (e.g. payment_status, receipt state). */
    String gatewayStatus;
    Integer errorCode;
    String error;
}
