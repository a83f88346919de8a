package com.rockpoint.payments.persistence.entity;

import com.rockpoint.payments.domain.OperationStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Fiscal receipt submission for a successful payment, linked 1:1 to the transaction.
 */
@Entity
@Table(name = "gateway_fiscalizations",
        uniqueConstraints = @UniqueConstraint(name = "uk_fiscalization_transaction", columnNames = "transaction_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FiscalizationEntity {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Column(name = "transaction_id", nullable = false, length = 36)
    private String transactionId;

    @Column(name = "gateway_payment_id", length = 128)
    private String gatewayPaymentId;

    @Column(name = "fiscal_url", nullable = false, length = 1000)
    private String fiscalUrl;

    @Column(name = "request_payload", columnDefinition = "TEXT")
    private String requestPayload;

    @Column(name = "response_payload", columnDefinition = "TEXT")
    private String responsePayload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private OperationStatus status;

    @Column(name = "error_code")
    private Integer errorCode;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "submitted_at", nullable = false)
    private Instant submittedAt;

    @Column(name = "completed_at")
    private Instant completedAt;
}
