package com.rockpoint.payments.persistence.repository;

import com.rockpoint.payments.domain.GatewayKind;
import com.rockpoint.payments.domain.TransactionStatus;
import com.rockpoint.payments.persistence.entity.GatewayTransactionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository for gateway payment attempts. Status changes go through the
 * conditional updates below ({@code WHERE status = :expected}); a return value
 * of 0 means another writer moved the row first.
 */
@Repository
public interface GatewayTransactionRepository extends JpaRepository<GatewayTransactionEntity, String>,
        JpaSpecificationExecutor<GatewayTransactionEntity> {

    boolean existsByOrderId(String orderId);

    Optional<GatewayTransactionEntity> findByOrderId(String orderId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE GatewayTransactionEntity t SET t.status = :next, t.updatedAt = :now "
            + "WHERE t.id = :id AND t.status = :expected")
    int updateStatusIfCurrent(@Param("id") String id,
                              @Param("expected") TransactionStatus expected,
                              @Param("next") TransactionStatus next,
                              @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE GatewayTransactionEntity t SET t.retryCount = :retryCount, t.updatedAt = :now "
            + "WHERE t.id = :id AND t.status = :status")
    int updateRetryCountIfStatus(@Param("id") String id,
                                 @Param("status") TransactionStatus status,
                                 @Param("retryCount") int retryCount,
                                 @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE GatewayTransactionEntity t SET t.posTransactionId = :posTransactionId, t.updatedAt = :now "
            + "WHERE t.id = :id AND t.status = :status AND t.posTransactionId IS NULL")
    int linkSaleIfEligible(@Param("id") String id,
                           @Param("status") TransactionStatus status,
                           @Param("posTransactionId") String posTransactionId,
                           @Param("now") Instant now);

    List<TransactionStatsRow> findByGatewayAndInitiatedAtGreaterThanEqual(GatewayKind gateway, Instant since);

    @Query("SELECT COALESCE(SUM(t.amountMajor), 0) FROM GatewayTransactionEntity t "
            + "WHERE t.gateway = :gateway AND t.status = :status AND t.initiatedAt >= :since")
    BigDecimal sumAmountByStatusSince(@Param("gateway") GatewayKind gateway,
                                      @Param("status") TransactionStatus status,
                                      @Param("since") Instant since);

    /** Projection used by the rolling statistics; avoids loading payload columns. */
    interface TransactionStatsRow {
        TransactionStatus getStatus();

        Integer getErrorCode();

        String getErrorMessage();

        Instant getInitiatedAt();

        Instant getCompletedAt();
    }
}
