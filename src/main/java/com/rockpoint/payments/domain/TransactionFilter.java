package com.rockpoint.payments.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Filters for listing transactions. Null fields are ignored.
 */
@Value
@Builder
public class TransactionFilter {

    GatewayKind gateway;
    TransactionStatus status;
    String employeeId;
    String terminalId;
    Integer errorCode;
    Instant initiatedFrom;
    Instant initiatedTo;
}
