package com.rockpoint.payments.persistence.entity;

import com.rockpoint.payments.domain.GatewayKind;
import com.rockpoint.payments.domain.TransactionStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One row per payment attempt against a wallet/QR gateway. Holds the verbatim
 * request and response payloads for replay and dispute handling. Rows are never
 * deleted; status only moves forward (see {@link TransactionStatus}).
 */
@Entity
@Table(name = "gateway_transactions",
        uniqueConstraints = @UniqueConstraint(name = "uk_gateway_tx_order_id", columnNames = "order_id"),
        indexes = {
                @Index(name = "idx_gateway_tx_gateway_status", columnList = "gateway, status"),
                @Index(name = "idx_gateway_tx_employee", columnList = "employee_id"),
                @Index(name = "idx_gateway_tx_terminal", columnList = "terminal_id"),
                @Index(name = "idx_gateway_tx_initiated_at", columnList = "initiated_at")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GatewayTransactionEntity {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "gateway", nullable = false, length = 20)
    private GatewayKind gateway;

    @Column(name = "order_id", nullable = false, length = 64)
    private String orderId;

    /** Our transaction id sent to the gateway. */
    @Column(name = "gateway_transaction_id", length = 64)
    private String gatewayTransactionId;

    /** Id assigned by the gateway once it accepts the payment. */
    @Column(name = "gateway_payment_id", length = 128)
    private String gatewayPaymentId;

    @Column(name = "amount_minor", nullable = false)
    private long amountMinor;

    @Column(name = "amount_major", nullable = false, precision = 19, scale = 2)
    private BigDecimal amountMajor;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private TransactionStatus status;

    @Column(name = "error_code")
    private Integer errorCode;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "timeout_occurred", nullable = false)
    private boolean timeoutOccurred;

    @Column(name = "employee_id", nullable = false, length = 64)
    private String employeeId;

    @Column(name = "terminal_id", nullable = false, length = 64)
    private String terminalId;

    @Column(name = "cashbox_code", length = 128)
    private String cashboxCode;

    @Column(name = "request_payload", columnDefinition = "TEXT")
    private String requestPayload;

    @Column(name = "response_payload", columnDefinition = "TEXT")
    private String responsePayload;

    @Column(name = "auth_header", length = 512)
    private String authHeader;

    @Column(name = "auth_timestamp")
    private Long authTimestamp;

    @Column(name = "client_phone_number", length = 32)
    private String clientPhoneNumber;

    @Column(name = "card_type", length = 32)
    private String cardType;

    @Column(name = "masked_card_number", length = 32)
    private String maskedCardNumber;

    @Column(name = "requires_confirmation", nullable = false)
    private boolean requiresConfirmation;

    @Column(name = "payment_url", length = 512)
    private String paymentUrl;

    /** POS sale this payment settles; set only by the explicit link operation. */
    @Column(name = "pos_transaction_id", length = 64)
    private String posTransactionId;

    @Column(name = "initiated_at", nullable = false, updatable = false)
    private Instant initiatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (initiatedAt == null) {
            initiatedAt = Instant.now();
        }
        updatedAt = initiatedAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
