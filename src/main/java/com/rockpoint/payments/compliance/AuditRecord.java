package com.rockpoint.payments.compliance;

import com.rockpoint.payments.domain.AuditAction;
import com.rockpoint.payments.domain.GatewayKind;
import com.rockpoint.payments.domain.TransactionStatus;
import com.rockpoint.payments.persistence.entity.GatewayTransactionEntity;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * One audit trail entry before it is written. Transaction fields are null for
 * actions not tied to a payment.
 */
@Value
@Builder
public class AuditRecord {

    String transactionId;
    String orderId;
    GatewayKind gateway;
    AuditAction action;
    /** Serialized to the JSON details column; must not contain secrets or raw OTP payloads. */
    Map<String, Object> details;
    String employeeId;
    String terminalId;
    String httpMethod;
    String endpoint;
    Integer responseStatus;
    Long responseTimeMs;

    /* Carried to the lifecycle event only. */
    String gatewayPaymentId;
    TransactionStatus status;
    BigDecimal amount;
    Integer errorCode;
    String errorMessage;

    /** Builder pre-filled with the transaction's identifiers, current status and amount. */
    public static AuditRecordBuilder forTransaction(GatewayTransactionEntity tx, AuditAction action) {
        return AuditRecord.builder()
                .transactionId(tx.getId())
                .orderId(tx.getOrderId())
                .gateway(tx.getGateway())
                .action(action)
                .employeeId(tx.getEmployeeId())
                .terminalId(tx.getTerminalId())
                .gatewayPaymentId(tx.getGatewayPaymentId())
                .status(tx.getStatus())
                .amount(tx.getAmountMajor())
                .errorCode(tx.getErrorCode())
                .errorMessage(tx.getErrorMessage());
    }
}
