package com.rockpoint.payments.persistence.entity;

import com.rockpoint.payments.domain.GatewayKind;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Append-only audit row. Written once, never updated or deleted by this service.
 */
@Entity
@Immutable
@Table(name = "gateway_audit_log", indexes = {
        @Index(name = "idx_audit_transaction", columnList = "transaction_id"),
        @Index(name = "idx_audit_action", columnList = "action"),
        @Index(name = "idx_audit_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEntryEntity {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    /** Null for actions that are not tied to a payment (e.g. config validation). */
    @Column(name = "transaction_id", length = 36)
    private String transactionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "gateway", length = 20)
    private GatewayKind gateway;

    @Column(name = "action", nullable = false, length = 50)
    private String action;

    @Column(name = "details", columnDefinition = "TEXT")
    private String details;

    @Column(name = "employee_id", length = 64)
    private String employeeId;

    @Column(name = "terminal_id", length = 64)
    private String terminalId;

    @Column(name = "http_method", length = 10)
    private String httpMethod;

    @Column(name = "endpoint", length = 512)
    private String endpoint;

    @Column(name = "response_status")
    private Integer responseStatus;

    @Column(name = "response_time_ms")
    private Long responseTimeMs;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
