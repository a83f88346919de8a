package com.rockpoint.payments.persistence.entity;

import com.rockpoint.payments.domain.OperationStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Merchant-initiated cancellation of a successful payment. At most one per
 * transaction; a failed reversal is re-used when the merchant tries again.
 */
@Entity
@Table(name = "gateway_reversals",
        uniqueConstraints = @UniqueConstraint(name = "uk_reversal_transaction", columnNames = "transaction_id"),
        indexes = @Index(name = "idx_reversal_order_id", columnList = "original_order_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReversalEntity {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Column(name = "transaction_id", nullable = false, length = 36)
    private String transactionId;

    @Column(name = "original_order_id", nullable = false, length = 64)
    private String originalOrderId;

    @Column(name = "gateway_payment_id", length = 128)
    private String gatewayPaymentId;

    @Column(name = "request_payload", columnDefinition = "TEXT")
    private String requestPayload;

    @Column(name = "response_payload", columnDefinition = "TEXT")
    private String responsePayload;

    @Column(name = "reversal_reason", length = 500)
    private String reason;

    @Column(name = "requested_by", nullable = false, length = 64)
    private String requestedBy;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private OperationStatus status;

    @Column(name = "error_code")
    private Integer errorCode;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "requested_at", nullable = false)
    private Instant requestedAt;

    @Column(name = "completed_at")
    private Instant completedAt;
}
