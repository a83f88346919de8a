package com.rockpoint.payments.api;

import com.rockpoint.payments.compliance.SensitiveDataMasker;
import com.rockpoint.payments.domain.GatewayKind;
import com.rockpoint.payments.domain.TransactionStatus;
import com.rockpoint.payments.persistence.entity.GatewayTransactionEntity;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Transaction as shown to the POS and admin UI. Raw payloads and the auth
 * header stay in the database.
 */
@Value
@Builder
public class TransactionResponseDto {

    String id;
    GatewayKind gateway;
    String orderId;
    String gatewayTransactionId;
    String gatewayPaymentId;
    BigDecimal amount;
    long amountMinor;
    TransactionStatus status;
    Integer errorCode;
    String errorMessage;
    int retryCount;
    boolean timeoutOccurred;
    String employeeId;
    String terminalId;
    String cashboxCode;
    String clientPhoneNumber;
    String cardType;
    String maskedCardNumber;
    boolean requiresConfirmation;
    String paymentUrl;
    String posTransactionId;
    Instant initiatedAt;
    Instant completedAt;

    public static TransactionResponseDto from(GatewayTransactionEntity tx) {
        return TransactionResponseDto.builder()
                .id(tx.getId())
                .gateway(tx.getGateway())
                .orderId(tx.getOrderId())
                .gatewayTransactionId(tx.getGatewayTransactionId())
                .gatewayPaymentId(tx.getGatewayPaymentId())
                .amount(tx.getAmountMajor())
                .amountMinor(tx.getAmountMinor())
                .status(tx.getStatus())
                .errorCode(tx.getErrorCode())
                .errorMessage(tx.getErrorMessage())
                .retryCount(tx.getRetryCount())
                .timeoutOccurred(tx.isTimeoutOccurred())
                .employeeId(tx.getEmployeeId())
                .terminalId(tx.getTerminalId())
                .cashboxCode(tx.getCashboxCode())
                .clientPhoneNumber(SensitiveDataMasker.maskPhone(tx.getClientPhoneNumber()))
                .cardType(tx.getCardType())
                .maskedCardNumber(tx.getMaskedCardNumber())
                .requiresConfirmation(tx.isRequiresConfirmation())
                .paymentUrl(tx.getPaymentUrl())
                .posTransactionId(tx.getPosTransactionId())
                .initiatedAt(tx.getInitiatedAt())
                .completedAt(tx.getCompletedAt())
                .build();
    }
}
