package com.rockpoint.payments.persistence.entity;

import com.rockpoint.payments.domain.GatewayKind;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persisted gateway credential or setting. Values flagged as encrypted are
 * stored AES-GCM encrypted when an encryption key is configured.
 */
@Entity
@Table(name = "gateway_config",
        uniqueConstraints = @UniqueConstraint(name = "uk_gateway_config_key", columnNames = {"gateway", "config_key"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GatewayConfigEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "gateway", nullable = false, length = 20)
    private GatewayKind gateway;

    @Column(name = "config_key", nullable = false, length = 100)
    private String configKey;

    @Column(name = "config_value", length = 2000)
    private String configValue;

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "is_encrypted", nullable = false)
    private boolean encrypted;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
