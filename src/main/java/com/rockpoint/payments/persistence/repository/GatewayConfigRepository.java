package com.rockpoint.payments.persistence.repository;

import com.rockpoint.payments.domain.GatewayKind;
import com.rockpoint.payments.persistence.entity.GatewayConfigEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface GatewayConfigRepository extends JpaRepository<GatewayConfigEntity, Long> {

    List<GatewayConfigEntity> findByGatewayAndActiveTrue(GatewayKind gateway);

    List<GatewayConfigEntity> findByGatewayOrderByConfigKeyAsc(GatewayKind gateway);

    Optional<GatewayConfigEntity> findByGatewayAndConfigKey(GatewayKind gateway, String configKey);

    Optional<GatewayConfigEntity> findByGatewayAndConfigKeyAndActiveTrue(GatewayKind gateway, String configKey);

    @Query("SELECT MAX(c.updatedAt) FROM GatewayConfigEntity c WHERE c.gateway = :gateway AND c.active = true")
    Instant findLastUpdated(@Param("gateway") GatewayKind gateway);
}
