package com.rockpoint.payments.persistence.repository;

import com.rockpoint.payments.domain.OperationStatus;
import com.rockpoint.payments.persistence.entity.ReversalEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

/** Spring Data repository for reversal records. */
@Repository
public interface ReversalRepository extends JpaRepository<ReversalEntity, String> {

    Optional<ReversalEntity> findByTransactionId(String transactionId);

    Optional<ReversalEntity> findByOriginalOrderId(String originalOrderId);

    /** Moves a finished attempt back to PENDING, only while it is still in {@code expected}. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ReversalEntity r SET r.status = :pending, r.reason = :reason, r.requestedBy = :requestedBy, "
            + "r.requestPayload = :requestPayload, r.responsePayload = NULL, r.errorCode = NULL, "
            + "r.errorMessage = NULL, r.requestedAt = :now, r.completedAt = NULL "
            + "WHERE r.id = :id AND r.status = :expected")
    int reopenIfStatus(@Param("id") String id,
                       @Param("expected") OperationStatus expected,
                       @Param("pending") OperationStatus pending,
                       @Param("reason") String reason,
                       @Param("requestedBy") String requestedBy,
                       @Param("requestPayload") String requestPayload,
                       @Param("now") Instant now);
}
