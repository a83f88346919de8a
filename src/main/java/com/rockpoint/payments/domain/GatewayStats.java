package com.rockpoint.payments.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Rolling 24h summary for one gateway, shown on the admin status page.
 */
@Value
@Builder
public class GatewayStats {

    GatewayKind gateway;
    long totalTransactions;
    long successfulTransactions;
    long failedTransactions;
    long pendingTransactions;
    BigDecimal totalAmountProcessed;
    long averageProcessingTimeMs;
    int successRatePercent;
    List<ErrorFrequency> commonErrors;

    @Value
    public static class ErrorFrequency {
        Integer errorCode;
        String errorMessage;
        long count;
    }
}
